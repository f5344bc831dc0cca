package io.taskline.jdbc;

import io.taskline.TasklineException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in
 * {@link io.taskline.jdbc.store} and the purgers in {@link io.taskline.jdbc.purge}.
 */
public final class TasklineStoreException extends TasklineException {
  public TasklineStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
