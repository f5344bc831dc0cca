package io.taskline.recurring;

import io.taskline.TasklineException;
import io.taskline.model.Job;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.JobStore;
import io.taskline.spi.MetricsExporter;
import io.taskline.spi.RecurringRunStore;
import io.taskline.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enqueues a job for each {@link RecurringJobDefinition} whenever its cadence comes due.
 *
 * <p>For every definition, a tick reads the persisted last run time, computes the next
 * due time with {@link CadenceRule#nextDue(Instant)} and, if due, inserts the job and
 * advances the last run time in one transaction. The advance is a compare-and-set on the
 * previously read value, so when several instances tick concurrently exactly one of them
 * enqueues. A definition seen for the first time is registered with the current time as
 * its last run and is not enqueued on that tick.
 *
 * <p>One definition failing never prevents the others from running.
 *
 * @see RecurringJobRegistry.Builder
 */
public final class RecurringJobRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RecurringJobRegistry.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final RecurringRunStore runStore;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final List<RecurringJobDefinition> definitions;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private RecurringJobRegistry(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.runStore = Objects.requireNonNull(builder.runStore, "runStore");
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.definitions = List.copyOf(builder.definitions.values());
    this.intervalMs = builder.intervalMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<RecurringJobDefinition> definitions() {
    return definitions;
  }

  /**
   * Starts the tick schedule. The first tick runs immediately.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RecurringJobRegistry has been closed");
    }
    if (tickTask != null) {
      return;
    }
    if (scheduler == null) {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("taskline-recurring-"));
    }
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the tick schedule; it can be started again.
   */
  public synchronized void stop() {
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
  }

  public boolean isRunning() {
    return tickTask != null && !closed;
  }

  /**
   * Runs one tick at the clock's current time.
   */
  public void tick() {
    if (closed) {
      return;
    }
    try {
      tick(clock.instant());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Recurring job tick failed", t);
    }
  }

  /**
   * Enqueues every definition due at {@code now}.
   *
   * @param now the evaluation time
   * @return the number of jobs enqueued
   */
  public int tick(Instant now) {
    int enqueued = 0;
    for (RecurringJobDefinition definition : definitions) {
      try {
        if (runIfDue(definition, now)) {
          enqueued++;
        }
      } catch (Exception e) {
        logger.log(Level.SEVERE, "Recurring job " + definition.id() + " could not be evaluated", e);
      }
    }
    return enqueued;
  }

  private boolean runIfDue(RecurringJobDefinition definition, Instant now) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Optional<Instant> lastRun = runStore.lastRunTime(conn, definition.id());
        if (lastRun.isEmpty()) {
          runStore.insert(conn, definition.id(), now);
          conn.commit();
          logger.log(Level.INFO, "Registered recurring job {0} ({1}), first run due at {2}",
              new Object[]{definition.id(), definition.cadence().describe(), definition.cadence().nextDue(now)});
          return false;
        }

        Instant nextDue = definition.cadence().nextDue(lastRun.get());
        if (now.isBefore(nextDue)) {
          conn.rollback();
          return false;
        }
        if (runStore.advance(conn, definition.id(), lastRun.get(), now) == 0) {
          conn.rollback();
          logger.log(Level.FINE, "Recurring job {0} was enqueued by another instance", definition.id());
          return false;
        }
        Job job = definition.toRequest(now).toJob(now);
        jobStore.insert(conn, job);
        conn.commit();
        metrics.incrementRecurringEnqueued();
        logger.log(Level.INFO, "Enqueued recurring job {0} as jobId={1} (due since {2})",
            new Object[]{definition.id(), job.jobId(), nextDue});
        return true;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  /**
   * Returns each definition with its last run time and next due time.
   *
   * @throws TasklineException if the run times cannot be read
   */
  public List<RecurringJobStatus> status() {
    try (Connection conn = connectionProvider.getConnection()) {
      List<RecurringJobStatus> statuses = new ArrayList<>(definitions.size());
      for (RecurringJobDefinition definition : definitions) {
        Instant lastRun = runStore.lastRunTime(conn, definition.id()).orElse(null);
        statuses.add(new RecurringJobStatus(definition.id(), definition.cadence().describe(),
            definition.jobType(), lastRun, lastRun == null ? null : definition.cadence().nextDue(lastRun)));
      }
      return statuses;
    } catch (SQLException e) {
      throw new TasklineException("Failed to read recurring job run times", e);
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    stop();
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RecurringJobRegistry}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private RecurringRunStore runStore;
    private Clock clock;
    private MetricsExporter metrics;
    private final Map<String, RecurringJobDefinition> definitions = new LinkedHashMap<>();
    private long intervalMs = 60_000;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store enqueued jobs are inserted into.
     *
     * <p><b>Required.</b>
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the store holding each definition's last run time.
     *
     * <p><b>Required.</b>
     */
    public Builder runStore(RecurringRunStore runStore) {
      this.runStore = runStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds a definition.
     *
     * @throws IllegalStateException if a definition with the same id was already added
     */
    public Builder definition(RecurringJobDefinition definition) {
      Objects.requireNonNull(definition, "definition");
      if (definitions.putIfAbsent(definition.id(), definition) != null) {
        throw new IllegalStateException("Duplicate recurring job definition: " + definition.id());
      }
      return this;
    }

    public Builder definitions(Collection<RecurringJobDefinition> definitions) {
      definitions.forEach(this::definition);
      return this;
    }

    /**
     * Sets the delay between ticks. Due times are evaluated at tick granularity.
     *
     * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public RecurringJobRegistry build() {
      return new RecurringJobRegistry(this);
    }
  }
}
