package io.taskline.model;

import io.taskline.JobType;

/**
 * Filter for listing jobs. Results are ordered by scheduled time, newest first.
 *
 * <pre>{@code
 * JobQuery query = JobQuery.forOwner("user-42")
 *     .withStatus(JobStatus.FAILED)
 *     .withJobType(StandardJobType.SCHEDULED_POST);
 * }</pre>
 *
 * @param ownerId owner filter, or {@code null} for all owners
 * @param status  status filter, or {@code null} for any status
 * @param jobType job type key filter, or {@code null} for any type
 * @param limit   maximum rows returned (&gt; 0)
 */
public record JobQuery(String ownerId, JobStatus status, String jobType, int limit) {
  public static final int DEFAULT_LIMIT = 100;

  public JobQuery {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
  }

  public static JobQuery all() {
    return new JobQuery(null, null, null, DEFAULT_LIMIT);
  }

  public static JobQuery forOwner(String ownerId) {
    return new JobQuery(ownerId, null, null, DEFAULT_LIMIT);
  }

  public JobQuery withStatus(JobStatus status) {
    return new JobQuery(ownerId, status, jobType, limit);
  }

  public JobQuery withJobType(JobType jobType) {
    return new JobQuery(ownerId, status, jobType == null ? null : jobType.key(), limit);
  }

  public JobQuery withLimit(int limit) {
    return new JobQuery(ownerId, status, jobType, limit);
  }
}
