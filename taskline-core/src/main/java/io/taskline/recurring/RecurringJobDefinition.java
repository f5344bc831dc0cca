package io.taskline.recurring;

import io.taskline.JobRequest;
import io.taskline.JobType;

import java.time.Instant;
import java.util.Objects;

/**
 * A job enqueued on a fixed cadence.
 *
 * @param id          stable definition id; the key of its persisted last run time
 * @param cadence     when the definition becomes due
 * @param jobType     job type key of the enqueued jobs
 * @param ownerId     owner of the enqueued jobs
 * @param payload     payload of the enqueued jobs, may be {@code null}
 * @param maxAttempts dispatch limit of the enqueued jobs
 */
public record RecurringJobDefinition(
    String id,
    CadenceRule cadence,
    String jobType,
    String ownerId,
    String payload,
    int maxAttempts) {

  public RecurringJobDefinition {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(cadence, "cadence");
    Objects.requireNonNull(jobType, "jobType");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    ownerId = ownerId == null ? JobRequest.SYSTEM_OWNER : ownerId;
  }

  /**
   * Creates a system-owned definition without payload and with the default attempt limit.
   */
  public static RecurringJobDefinition of(String id, CadenceRule cadence, JobType jobType) {
    return new RecurringJobDefinition(id, cadence, Objects.requireNonNull(jobType, "jobType").key(),
        JobRequest.SYSTEM_OWNER, null, JobRequest.DEFAULT_MAX_ATTEMPTS);
  }

  public RecurringJobDefinition withPayload(String newPayload) {
    return new RecurringJobDefinition(id, cadence, jobType, ownerId, newPayload, maxAttempts);
  }

  public RecurringJobDefinition withMaxAttempts(int newMaxAttempts) {
    return new RecurringJobDefinition(id, cadence, jobType, ownerId, payload, newMaxAttempts);
  }

  /**
   * Creates the request for one run, due immediately.
   */
  public JobRequest toRequest(Instant now) {
    return JobRequest.builder(jobType)
        .ownerId(ownerId)
        .payload(payload)
        .maxAttempts(maxAttempts)
        .scheduledTime(now)
        .build();
  }
}
