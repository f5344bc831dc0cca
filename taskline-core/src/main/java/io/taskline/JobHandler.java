package io.taskline;

/**
 * Performs the work of one job type.
 *
 * <p>Delivery is at-least-once: a handler may run again for the same job if the
 * completion write fails after the side effect succeeded, or after a timeout.
 * Handlers must therefore be idempotent or safe to re-run.
 *
 * <p>Handlers that call a third-party API on behalf of the owner obtain the token with
 * {@link io.taskline.credential.TokenRefreshManager#getValidToken(String, String)}
 * instead of reading stored credentials directly.
 */
@FunctionalInterface
public interface JobHandler {

  /**
   * Executes the job.
   *
   * @param context the claimed job
   * @return {@link JobResult#ok(String)} on success or {@link JobResult#err(ErrorKind, String)} on failure
   * @throws Exception on failure; mapped with {@link JobResult#fromException(Throwable)}
   */
  JobResult handle(JobContext context) throws Exception;
}
