package io.taskline;

import java.time.Instant;
import java.util.Objects;

/**
 * The view of a claimed job handed to a {@link JobHandler}.
 *
 * @param jobId         unique job id
 * @param jobType       persisted job type key
 * @param ownerId       owner the job runs on behalf of
 * @param payload       opaque payload text (typically JSON), may be {@code null}
 * @param attempt       1-based number of this dispatch
 * @param maxAttempts   maximum dispatches before the job fails for good
 * @param scheduledTime when the job became due
 */
public record JobContext(
    String jobId,
    String jobType,
    String ownerId,
    String payload,
    int attempt,
    int maxAttempts,
    Instant scheduledTime) {

  public JobContext {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(ownerId, "ownerId");
  }

  /**
   * Returns {@code true} if a failure of this dispatch will not be retried.
   */
  public boolean isLastAttempt() {
    return attempt >= maxAttempts;
  }
}
