package io.taskline;

import java.util.Objects;

/**
 * Outcome returned by {@link JobHandler#handle(JobContext)}.
 *
 * <ul>
 *   <li>{@link Ok}: the job succeeded; the optional value is stored as the job result.</li>
 *   <li>{@link Err}: the job failed; the {@link ErrorKind} decides whether it is retried.</li>
 * </ul>
 *
 * <p>Handlers may also throw. Thrown exceptions are mapped with {@link #fromException(Throwable)}.
 */
public sealed interface JobResult permits JobResult.Ok, JobResult.Err {

  /**
   * Creates a successful result with no stored value.
   *
   * @return an ok result
   */
  static Ok ok() {
    return new Ok(null);
  }

  /**
   * Creates a successful result.
   *
   * @param value result text to store on the job (typically JSON), may be {@code null}
   * @return an ok result
   */
  static Ok ok(String value) {
    return new Ok(value);
  }

  /**
   * Creates a failed result.
   *
   * @param kind   failure classification
   * @param detail human-readable failure detail
   * @return an error result
   */
  static Err err(ErrorKind kind, String detail) {
    return new Err(kind, detail);
  }

  static Err transientError(String detail) {
    return new Err(ErrorKind.TRANSIENT, detail);
  }

  static Err permanentError(String detail) {
    return new Err(ErrorKind.PERMANENT, detail);
  }

  /**
   * Maps a handler exception to an error result.
   *
   * <p>{@link PermanentJobException} maps to {@link ErrorKind#PERMANENT}. An
   * {@link AuthException} that requires re-authorization maps to {@link ErrorKind#AUTH};
   * any other {@code AuthException} (a transient refresh failure) and every other
   * throwable map to {@link ErrorKind#TRANSIENT}.
   *
   * @param failure the exception thrown by a handler
   * @return the equivalent error result
   */
  static Err fromException(Throwable failure) {
    Objects.requireNonNull(failure, "failure");
    String detail = describe(failure);
    if (failure instanceof PermanentJobException) {
      return new Err(ErrorKind.PERMANENT, detail);
    }
    if (failure instanceof AuthException auth) {
      return new Err(auth.reauthorizationRequired() ? ErrorKind.AUTH : ErrorKind.TRANSIENT, detail);
    }
    return new Err(ErrorKind.TRANSIENT, detail);
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : failure.getClass().getSimpleName() + ": " + message;
  }

  /**
   * Job succeeded.
   *
   * @param value result text, may be {@code null}
   */
  record Ok(String value) implements JobResult {
  }

  /**
   * Job failed.
   *
   * @param kind   failure classification (never null)
   * @param detail failure detail (never null)
   */
  record Err(ErrorKind kind, String detail) implements JobResult {
    public Err {
      Objects.requireNonNull(kind, "kind");
      detail = detail == null ? kind.name() : detail;
    }
  }
}
