package io.taskline;

/**
 * Thrown by a handler for a failure that may succeed on a later attempt
 * (network error, rate limit, upstream outage).
 *
 * <p>Equivalent to returning {@code JobResult.err(ErrorKind.TRANSIENT, message)}.
 */
public class TransientJobException extends RuntimeException {

  public TransientJobException(String message) {
    super(message);
  }

  public TransientJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
