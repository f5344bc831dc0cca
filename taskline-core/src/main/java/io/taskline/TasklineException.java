package io.taskline;

/**
 * Unchecked exception for failures reaching the backing store
 * (connection unavailable, statement failed) outside the scheduler loop.
 */
public class TasklineException extends RuntimeException {

  public TasklineException(String message, Throwable cause) {
    super(message, cause);
  }
}
