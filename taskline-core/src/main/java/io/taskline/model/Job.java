package io.taskline.model;

import java.time.Instant;

/**
 * A persisted job row.
 *
 * @param jobId         unique job id
 * @param jobType       handler key
 * @param ownerId       owner the job runs on behalf of
 * @param payload       opaque payload text, may be {@code null}
 * @param scheduledTime earliest time the job may run; advanced by backoff on retry
 * @param status        current state
 * @param attempts      number of dispatches so far
 * @param maxAttempts   dispatch limit
 * @param lastError     most recent failure, or {@code null}
 * @param result        handler result text, or {@code null}
 * @param createdAt     when the job was scheduled
 * @param executedAt    when the last dispatch finished, or {@code null}
 * @param cancelledAt   when the job was cancelled, or {@code null}
 */
public record Job(
    String jobId,
    String jobType,
    String ownerId,
    String payload,
    Instant scheduledTime,
    JobStatus status,
    int attempts,
    int maxAttempts,
    JobError lastError,
    String result,
    Instant createdAt,
    Instant executedAt,
    Instant cancelledAt) {

  public boolean isDue(Instant now) {
    return status == JobStatus.PENDING && !scheduledTime.isAfter(now);
  }
}
