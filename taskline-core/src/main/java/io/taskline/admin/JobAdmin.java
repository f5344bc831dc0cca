package io.taskline.admin;

import io.taskline.JobRequest;
import io.taskline.StandardJobType;
import io.taskline.Taskline;
import io.taskline.TasklineException;
import io.taskline.model.Job;
import io.taskline.model.JobQuery;
import io.taskline.model.JobStatus;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative operations on jobs and the scheduler: enqueue, query, cancel, status.
 *
 * <p>Each method obtains its own auto-committed connection. Store failures surface as
 * {@link TasklineException}.
 *
 * <pre>{@code
 * JobAdmin admin = new JobAdmin(connProvider, jobStore, Clock.systemUTC(), taskline);
 * String jobId = admin.schedulePost("user-42", "{\"postId\":\"p-1\"}", publishAt);
 * boolean cancelled = admin.cancel(jobId);
 * }</pre>
 */
public final class JobAdmin {
  private static final Logger logger = Logger.getLogger(JobAdmin.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final Clock clock;
  private final Taskline taskline;

  /**
   * @param connectionProvider the connection provider
   * @param jobStore           the job store
   * @param clock              clock for creation and cancellation times
   * @param taskline           the running composite, or {@code null} when the scheduler
   *                           runs in another process
   */
  public JobAdmin(ConnectionProvider connectionProvider, JobStore jobStore, Clock clock, Taskline taskline) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.taskline = taskline;
  }

  /**
   * Stores the job as PENDING.
   *
   * @return the job id
   */
  public String schedule(JobRequest request) {
    Objects.requireNonNull(request, "request");
    Job job = request.toJob(clock.instant());
    withConnection(conn -> {
      jobStore.insert(conn, job);
      return null;
    });
    logger.log(Level.FINE, "Scheduled jobId={0} type={1} at {2}",
        new Object[]{job.jobId(), job.jobType(), job.scheduledTime()});
    return job.jobId();
  }

  /**
   * Schedules a {@code scheduled_post} job.
   *
   * @throws IllegalArgumentException if {@code scheduledTime} is not in the future
   */
  public String schedulePost(String ownerId, String payload, Instant scheduledTime) {
    return scheduleAt(StandardJobType.SCHEDULED_POST, ownerId, payload, scheduledTime);
  }

  /**
   * Schedules an {@code email_campaign} job.
   *
   * @throws IllegalArgumentException if {@code scheduledTime} is not in the future
   */
  public String scheduleEmailCampaign(String ownerId, String payload, Instant scheduledTime) {
    return scheduleAt(StandardJobType.EMAIL_CAMPAIGN, ownerId, payload, scheduledTime);
  }

  private String scheduleAt(StandardJobType type, String ownerId, String payload, Instant scheduledTime) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(scheduledTime, "scheduledTime");
    if (!scheduledTime.isAfter(clock.instant())) {
      throw new IllegalArgumentException("scheduledTime must be in the future: " + scheduledTime);
    }
    return schedule(JobRequest.builder(type)
        .ownerId(ownerId)
        .payload(payload)
        .scheduledTime(scheduledTime)
        .build());
  }

  /**
   * Cancels a PENDING job.
   *
   * @return {@code true} if the job was cancelled; {@code false} if it does not exist or
   *     is no longer PENDING
   */
  public boolean cancel(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    int updated = withConnection(conn -> jobStore.cancel(conn, jobId, clock.instant()));
    if (updated > 0) {
      logger.log(Level.INFO, "Cancelled job {0}", jobId);
    }
    return updated > 0;
  }

  public Optional<Job> job(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    return withConnection(conn -> jobStore.findById(conn, jobId));
  }

  public List<Job> jobs(JobQuery query) {
    Objects.requireNonNull(query, "query");
    return withConnection(conn -> jobStore.query(conn, query));
  }

  /**
   * Returns the number of jobs in each status; every status is present.
   */
  public Map<JobStatus, Long> statusCounts() {
    Map<JobStatus, Long> stored = withConnection(jobStore::countByStatus);
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, stored.getOrDefault(status, 0L));
    }
    return counts;
  }

  public SchedulerStatus schedulerStatus() {
    Map<JobStatus, Long> counts = statusCounts();
    if (taskline == null) {
      return new SchedulerStatus(false, 0, List.of(), counts);
    }
    return new SchedulerStatus(taskline.isRunning(), taskline.scheduler().activeJobs(),
        taskline.recurring().status(), counts);
  }

  /**
   * @throws IllegalStateException if no composite is attached
   */
  public void start() {
    requireTaskline().start();
  }

  /**
   * @throws IllegalStateException if no composite is attached
   */
  public void stop() {
    requireTaskline().stop();
  }

  private Taskline requireTaskline() {
    if (taskline == null) {
      throw new IllegalStateException("No scheduler attached to this JobAdmin");
    }
    return taskline;
  }

  private <T> T withConnection(SqlFunction<T> fn) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return fn.apply(conn);
    } catch (SQLException e) {
      throw new TasklineException("Job store operation failed", e);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }
}
