package io.taskline;

/**
 * Thrown by a handler for a failure that will never succeed on retry
 * (malformed payload, business-rule rejection). The job is failed immediately.
 */
public class PermanentJobException extends RuntimeException {

  public PermanentJobException(String message) {
    super(message);
  }

  public PermanentJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
