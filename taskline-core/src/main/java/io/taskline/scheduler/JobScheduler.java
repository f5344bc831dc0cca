package io.taskline.scheduler;

import io.taskline.ErrorKind;
import io.taskline.JobContext;
import io.taskline.JobHandler;
import io.taskline.JobResult;
import io.taskline.JobType;
import io.taskline.model.Job;
import io.taskline.model.JobError;
import io.taskline.registry.HandlerRegistry;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.JobStore;
import io.taskline.spi.MetricsExporter;
import io.taskline.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims due jobs on a fixed tick and runs them on a bounded worker pool.
 *
 * <p>Each {@linkplain #tick() tick} claims at most as many jobs as there are idle
 * workers (and at most {@code batchSize}), then hands them to the pool and returns
 * without waiting. A claimed job has already left PENDING, so no other tick or scheduler
 * instance can dispatch it again while it runs.
 *
 * <p>Every handler invocation is guarded by a per-job-type timeout. Whichever comes first,
 * the handler's outcome or the timeout, is written to the {@link JobStore}; the timeout is
 * recorded as a {@link ErrorKind#TRANSIENT} failure and the handler thread is interrupted.
 * Failures are retried with the {@link RetryPolicy} until {@code maxAttempts} is reached.
 *
 * <p>Handler failures and store errors are logged and never escape the loop.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()}, {@link #stop()} and
 * {@link #close()} are synchronized; {@link #tick()} may be called directly, which is how
 * tests drive the scheduler with a fixed {@link Clock}.
 *
 * @see JobScheduler.Builder
 */
public final class JobScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final HandlerRegistry handlerRegistry;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final String workerId;
  private final int batchSize;
  private final int workerCount;
  private final long intervalMs;
  private final Duration defaultTimeout;
  private final Map<String, Duration> timeouts;
  private final Duration staleClaimTimeout;
  private final long drainTimeoutMs;

  private final ExecutorService workers;
  private final ScheduledThreadPoolExecutor watchdog;
  private final AtomicInteger inFlight = new AtomicInteger();

  private ScheduledExecutorService ticker;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private JobScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0L) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    requirePositive(builder.defaultTimeout, "defaultTimeout");
    requirePositive(builder.staleClaimTimeout, "staleClaimTimeout");
    Duration longest = builder.defaultTimeout;
    for (Map.Entry<String, Duration> entry : builder.timeouts.entrySet()) {
      requirePositive(entry.getValue(), "timeout for " + entry.getKey());
      if (entry.getValue().compareTo(longest) > 0) {
        longest = entry.getValue();
      }
    }
    if (builder.staleClaimTimeout.compareTo(longest) <= 0) {
      throw new IllegalArgumentException("staleClaimTimeout must exceed every handler timeout (longest: "
          + longest + ")");
    }

    handlerRegistry.validate(builder.requiredJobTypes);

    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.workerId = builder.workerId != null
        ? builder.workerId : "scheduler-" + UUID.randomUUID().toString().substring(0, 8);
    this.batchSize = builder.batchSize;
    this.workerCount = builder.workerCount;
    this.intervalMs = builder.intervalMs;
    this.defaultTimeout = builder.defaultTimeout;
    this.timeouts = Map.copyOf(builder.timeouts);
    this.staleClaimTimeout = builder.staleClaimTimeout;
    this.drainTimeoutMs = builder.drainTimeoutMs;

    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("taskline-worker-"));
    this.watchdog = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("taskline-timeout-"));
    this.watchdog.setRemoveOnCancelPolicy(true);
  }

  private static void requirePositive(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the tick schedule. The first tick runs immediately. Subsequent calls are
   * no-ops while running.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobScheduler has been closed");
    }
    if (tickTask != null) {
      return;
    }
    if (ticker == null) {
      ticker = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("taskline-scheduler-"));
    }
    tickTask = ticker.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Job scheduler {0} started (intervalMs={1}, workers={2})",
        new Object[]{workerId, intervalMs, workerCount});
  }

  /**
   * Stops claiming new jobs. Jobs already dispatched run to completion. The scheduler can
   * be started again.
   */
  public synchronized void stop() {
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
      logger.log(Level.INFO, "Job scheduler {0} stopped", workerId);
    }
  }

  /**
   * Returns {@code true} while the tick schedule is active.
   */
  public boolean isRunning() {
    return tickTask != null && !closed;
  }

  /**
   * Returns the number of handlers currently executing.
   */
  public int activeJobs() {
    return inFlight.get();
  }

  /**
   * Returns the identifier recorded in {@code claimed_by} for jobs claimed by this instance.
   */
  public String workerId() {
    return workerId;
  }

  /**
   * Executes a single tick: recovers abandoned claims, claims due jobs up to the free
   * worker capacity, and dispatches them. Called automatically by the schedule, but may
   * also be invoked directly.
   */
  public void tick() {
    if (closed) {
      return;
    }
    try {
      Instant now = clock.instant();
      releaseStaleClaims(now);

      int capacity = workerCount - inFlight.get();
      if (capacity <= 0) {
        return;
      }
      List<Job> claimed = claimDue(now, Math.min(batchSize, capacity));
      if (claimed.isEmpty()) {
        return;
      }
      metrics.incrementJobsClaimed(claimed.size());
      for (Job job : claimed) {
        dispatch(job);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduler tick failed", t);
    }
  }

  private List<Job> claimDue(Instant now, int limit) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      // Two-phase claims (UPDATE then SELECT) must run in one transaction
      conn.setAutoCommit(false);
      try {
        List<Job> claimed = jobStore.claimDue(conn, workerId, now, limit);
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  private void releaseStaleClaims(Instant now) throws SQLException {
    Instant claimedBefore = now.minus(staleClaimTimeout);
    JobError error = new JobError(ErrorKind.TRANSIENT,
        "Claim abandoned: no outcome recorded within " + staleClaimTimeout, now);
    int released;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      released = jobStore.releaseStale(conn, claimedBefore, error);
    }
    if (released > 0) {
      logger.log(Level.WARNING, "Released {0} job(s) claimed before {1} without an outcome",
          new Object[]{released, claimedBefore});
    }
  }

  private void dispatch(Job job) {
    Execution execution = new Execution(job);
    JobHandler handler = handlerRegistry.handlerFor(job.jobType());
    if (handler == null) {
      settle(execution, JobResult.permanentError("No handler registered for job type: " + job.jobType()));
      return;
    }

    inFlight.incrementAndGet();
    metrics.recordActiveWorkers(inFlight.get());
    try {
      execution.future = workers.submit(() -> execute(execution, handler));
    } catch (RejectedExecutionException e) {
      releaseWorker();
      settle(execution, JobResult.transientError("Scheduler is shutting down"));
      return;
    }

    Duration timeout = timeoutFor(job.jobType());
    try {
      execution.timeoutTask = watchdog.schedule(
          () -> onTimeout(execution, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Timeout watchdog is shut down; jobId=" + job.jobId()
          + " runs without a timeout", e);
    }
    logger.log(Level.FINE, "Dispatched jobId={0} type={1} attempt={2}",
        new Object[]{job.jobId(), job.jobType(), job.attempts()});
  }

  private void execute(Execution execution, JobHandler handler) {
    try {
      JobResult result;
      try {
        result = handler.handle(execution.context());
        if (result == null) {
          result = JobResult.ok();
        }
      } catch (Throwable t) {
        result = JobResult.fromException(t);
      }
      settle(execution, result);
    } finally {
      releaseWorker();
    }
  }

  private void onTimeout(Execution execution, Duration timeout) {
    boolean settled = settle(execution,
        JobResult.transientError("Handler timed out after " + timeout.toMillis() + " ms"));
    if (!settled) {
      return;
    }
    metrics.incrementJobsTimedOut();
    Future<?> future = execution.future;
    if (future != null) {
      future.cancel(true);
    }
  }

  private void releaseWorker() {
    metrics.recordActiveWorkers(inFlight.decrementAndGet());
  }

  /**
   * Records the outcome of an execution exactly once.
   *
   * @return {@code true} if this call recorded the outcome
   */
  private boolean settle(Execution execution, JobResult result) {
    if (!execution.settled.compareAndSet(false, true)) {
      return false;
    }
    ScheduledFuture<?> timeoutTask = execution.timeoutTask;
    if (timeoutTask != null) {
      timeoutTask.cancel(false);
    }
    Instant now = clock.instant();
    if (result instanceof JobResult.Ok ok) {
      markCompleted(execution.job, ok.value(), now);
    } else if (result instanceof JobResult.Err err) {
      markFailed(execution.job, err, now);
    }
    return true;
  }

  private void markCompleted(Job job, String result, Instant now) {
    int updated = withConnection("mark COMPLETED", job.jobId(),
        conn -> jobStore.complete(conn, job.jobId(), result, now));
    if (updated > 0) {
      metrics.incrementJobsCompleted();
      logger.log(Level.FINE, "Job {0} completed", job.jobId());
    } else {
      logger.log(Level.WARNING, "Job {0} was no longer PROCESSING when its completion was recorded",
          job.jobId());
    }
  }

  private void markFailed(Job job, JobResult.Err err, Instant now) {
    JobError error = new JobError(err.kind(), err.detail(), now);
    boolean retry = err.kind().isRetryable() && job.attempts() < job.maxAttempts();
    Instant retryAt = retry ? now.plusMillis(retryPolicy.computeDelayMs(job.attempts())) : null;

    int updated = withConnection(retry ? "schedule retry" : "mark FAILED", job.jobId(),
        conn -> jobStore.fail(conn, job.jobId(), error, retryAt));
    if (updated == 0) {
      logger.log(Level.WARNING, "Job {0} was no longer PROCESSING when its failure was recorded",
          job.jobId());
      return;
    }
    if (retry) {
      metrics.incrementJobsRetried();
      logger.log(Level.WARNING, "Job {0} ({1}) failed attempt {2}/{3}, retrying at {4}: {5}",
          new Object[]{job.jobId(), job.jobType(), job.attempts(), job.maxAttempts(), retryAt, err.detail()});
    } else {
      metrics.incrementJobsFailed();
      String reason = err.kind() == ErrorKind.AUTH
          ? "reauthorization required for owner " + job.ownerId()
          : err.kind() + " after " + job.attempts() + " attempt(s)";
      logger.log(Level.WARNING, "Job {0} ({1}) FAILED, {2}: {3}",
          new Object[]{job.jobId(), job.jobType(), reason, err.detail()});
    }
  }

  private int withConnection(String action, String jobId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for jobId=" + jobId
          + "; the claim will be released after " + staleClaimTimeout, e);
      return 0;
    }
  }

  private Duration timeoutFor(String jobType) {
    return timeouts.getOrDefault(jobType, defaultTimeout);
  }

  @FunctionalInterface
  private interface SqlAction {
    int execute(Connection conn) throws SQLException;
  }

  private static final class Execution {
    private final Job job;
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile Future<?> future;
    private volatile ScheduledFuture<?> timeoutTask;

    private Execution(Job job) {
      this.job = job;
    }

    private JobContext context() {
      return new JobContext(job.jobId(), job.jobType(), job.ownerId(), job.payload(),
          job.attempts(), job.maxAttempts(), job.scheduledTime());
    }
  }

  /**
   * Stops ticking, waits up to the drain timeout for running handlers, then interrupts
   * whatever is left. Interrupted jobs are recorded as transient failures.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      stop();
      closed = true;
      if (ticker != null) {
        ticker.shutdownNow();
      }
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting {0} running job(s)", inFlight.get());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      watchdog.shutdownNow();
    }
  }

  /** Builder for {@link JobScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private HandlerRegistry handlerRegistry;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private MetricsExporter metrics;
    private String workerId;
    private int batchSize = 50;
    private int workerCount = 4;
    private long intervalMs = 5000;
    private Duration defaultTimeout = Duration.ofMinutes(5);
    private final Map<String, Duration> timeouts = new HashMap<>();
    private Duration staleClaimTimeout = Duration.ofMinutes(30);
    private long drainTimeoutMs = 5000;
    private final List<JobType> requiredJobTypes = new ArrayList<>();

    private Builder() {
    }

    /**
     * Sets the connection provider used for claims and status updates.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the job store.
     *
     * <p><b>Required.</b>
     *
     * @param jobStore the persistence backend
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the registry resolving job types to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the backoff applied between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 5 s base and a 1 h cap.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the clock used for due-time comparisons and recorded timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the identifier stored in {@code claimed_by}, e.g. the host or pod name.
     *
     * <p>Optional. Defaults to a random {@code scheduler-xxxxxxxx} id.
     *
     * @param workerId the scheduler instance id
     * @return this builder
     */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Sets the maximum number of jobs claimed per tick.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     *
     * @param batchSize max jobs per tick
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the number of worker threads, which is also the ceiling on concurrently running jobs.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     *
     * @param workerCount worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the delay between the end of one tick and the start of the next.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param intervalMs tick interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets the handler timeout for job types without a specific one.
     *
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param defaultTimeout the default handler timeout
     * @return this builder
     */
    public Builder defaultTimeout(Duration defaultTimeout) {
      this.defaultTimeout = defaultTimeout;
      return this;
    }

    /**
     * Sets the handler timeout for one job type.
     *
     * @param jobType the job type
     * @param timeout the handler timeout
     * @return this builder
     */
    public Builder timeout(JobType jobType, Duration timeout) {
      return timeout(Objects.requireNonNull(jobType, "jobType").key(), timeout);
    }

    /**
     * Sets the handler timeout for one job type key.
     *
     * @param jobType the job type key
     * @param timeout the handler timeout
     * @return this builder
     */
    public Builder timeout(String jobType, Duration timeout) {
      this.timeouts.put(Objects.requireNonNull(jobType, "jobType"), timeout);
      return this;
    }

    /**
     * Sets how long a claim may stay without an outcome before the job is returned to
     * PENDING (or FAILED when no attempts remain). Covers schedulers that crashed mid-job.
     *
     * <p>Optional. Defaults to 30 minutes. Must exceed every handler timeout.
     *
     * @param staleClaimTimeout the claim expiry
     * @return this builder
     */
    public Builder staleClaimTimeout(Duration staleClaimTimeout) {
      this.staleClaimTimeout = staleClaimTimeout;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link JobScheduler#close()} waits for running handlers.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Declares job types that must have a registered handler. {@link #build()} fails
     * if any of them is missing.
     *
     * @param jobTypes the required job types
     * @return this builder
     */
    public Builder requireHandlers(Collection<? extends JobType> jobTypes) {
      this.requiredJobTypes.addAll(jobTypes);
      return this;
    }

    /**
     * Builds the scheduler and starts its worker pool. Call {@link JobScheduler#start()}
     * to begin ticking.
     *
     * @return a new {@link JobScheduler}
     * @throws NullPointerException     if {@code connectionProvider}, {@code jobStore} or
     *                                  {@code handlerRegistry} is null
     * @throws IllegalArgumentException if a size, interval or timeout is out of range
     * @throws IllegalStateException    if a required job type has no handler
     */
    public JobScheduler build() {
      return new JobScheduler(this);
    }
  }
}
