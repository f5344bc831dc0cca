package io.taskline;

import com.github.f4b6a3.ulid.UlidCreator;
import io.taskline.model.Job;
import io.taskline.model.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable request to schedule a job.
 *
 * <p>Each request is assigned a monotonic ULID {@code jobId} by default. When neither
 * {@code scheduledTime} nor {@code delay} is set the job is due as soon as it is stored.
 *
 * <pre>{@code
 * JobRequest request = JobRequest.builder(StandardJobType.SCHEDULED_POST)
 *     .ownerId("user-42")
 *     .payload("{\"postId\":\"p-1\"}")
 *     .scheduledTime(Instant.parse("2026-06-01T09:00:00Z"))
 *     .build();
 * }</pre>
 *
 * @see io.taskline.admin.JobAdmin#schedule(JobRequest)
 */
public final class JobRequest {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final String SYSTEM_OWNER = "system";

  private final String jobId;
  private final String jobType;
  private final String ownerId;
  private final String payload;
  private final Instant scheduledTime;
  private final Duration delay;
  private final int maxAttempts;

  private JobRequest(Builder builder) {
    this.jobId = builder.jobId == null ? newJobId() : builder.jobId;
    this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
    if (jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
    this.ownerId = builder.ownerId == null ? SYSTEM_OWNER : builder.ownerId;
    if (builder.scheduledTime != null && builder.delay != null) {
      throw new IllegalArgumentException("Set either scheduledTime or delay, not both");
    }
    if (builder.delay != null && builder.delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.payload = builder.payload;
    this.scheduledTime = builder.scheduledTime;
    this.delay = builder.delay;
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder(JobType jobType) {
    return new Builder(Objects.requireNonNull(jobType, "jobType").key());
  }

  public static Builder builder(String jobType) {
    return new Builder(jobType);
  }

  public String jobId() {
    return jobId;
  }

  public String jobType() {
    return jobType;
  }

  public String ownerId() {
    return ownerId;
  }

  public String payload() {
    return payload;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Resolves the time the job becomes due, relative to {@code now} when a delay was given.
   */
  public Instant scheduledTime(Instant now) {
    if (scheduledTime != null) {
      return scheduledTime;
    }
    return delay == null ? now : now.plus(delay);
  }

  /**
   * Creates the pending job row for this request.
   *
   * @param now creation time
   * @return a pending job with zero attempts
   */
  public Job toJob(Instant now) {
    return new Job(jobId, jobType, ownerId, payload, scheduledTime(now), JobStatus.PENDING,
        0, maxAttempts, null, null, now, null, null);
  }

  @Override
  public String toString() {
    return "JobRequest{jobId=" + jobId + ", jobType=" + jobType + ", ownerId=" + ownerId + "}";
  }

  private static String newJobId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /** Builder for {@link JobRequest}. */
  public static final class Builder {
    private final String jobType;
    private String jobId;
    private String ownerId;
    private String payload;
    private Instant scheduledTime;
    private Duration delay;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private Builder(String jobType) {
      this.jobType = jobType;
    }

    /**
     * Overrides the generated job id. Use for idempotent scheduling keyed on a business id.
     */
    public Builder jobId(String jobId) {
      this.jobId = jobId;
      return this;
    }

    /**
     * Sets the owner. Defaults to {@value JobRequest#SYSTEM_OWNER}.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder payload(String payload) {
      this.payload = payload;
      return this;
    }

    public Builder scheduledTime(Instant scheduledTime) {
      this.scheduledTime = scheduledTime;
      return this;
    }

    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    /**
     * Sets the dispatch limit. Defaults to {@value JobRequest#DEFAULT_MAX_ATTEMPTS}; must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * @return the request
     * @throws NullPointerException if the job type is null
     * @throws IllegalArgumentException if the job type is empty, both {@code scheduledTime} and
     *     {@code delay} are set, {@code delay} is negative, or {@code maxAttempts < 1}
     */
    public JobRequest build() {
      return new JobRequest(this);
    }
  }
}
