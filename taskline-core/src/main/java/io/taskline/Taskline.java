package io.taskline;

import io.taskline.credential.TokenRefreshManager;
import io.taskline.recurring.RecurringJobDefinition;
import io.taskline.recurring.RecurringJobRegistry;
import io.taskline.registry.HandlerRegistry;
import io.taskline.scheduler.JobScheduler;
import io.taskline.scheduler.RetryPolicy;
import io.taskline.spi.ConnectionProvider;
import io.taskline.spi.JobStore;
import io.taskline.spi.MetricsExporter;
import io.taskline.spi.RecurringRunStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link JobScheduler} and a {@link RecurringJobRegistry}
 * into a single {@link AutoCloseable} unit.
 *
 * <p>Every job type produced by a recurring definition must have a handler; {@link Builder#build()}
 * fails otherwise.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Taskline taskline = Taskline.builder()
 *     .connectionProvider(connProvider)
 *     .jobStore(jobStore)
 *     .runStore(runStore)
 *     .handlerRegistry(registry)
 *     .definitions(DefaultRecurringJobs.definitions(ZoneOffset.UTC))
 *     .build()) {
 *   taskline.start();
 *   // ...
 * }
 * }</pre>
 *
 * @see JobScheduler
 * @see RecurringJobRegistry
 */
public final class Taskline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Taskline.class.getName());

  private final JobScheduler scheduler;
  private final RecurringJobRegistry recurring;
  private final TokenRefreshManager refreshManager;
  private final MetricsExporter metrics;

  private Taskline(JobScheduler scheduler, RecurringJobRegistry recurring,
      TokenRefreshManager refreshManager, MetricsExporter metrics) {
    this.scheduler = scheduler;
    this.recurring = recurring;
    this.refreshManager = refreshManager;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public JobScheduler scheduler() {
    return scheduler;
  }

  public RecurringJobRegistry recurring() {
    return recurring;
  }

  /**
   * Starts the recurring registry and the scheduler.
   */
  public synchronized void start() {
    recurring.start();
    scheduler.start();
    logger.log(Level.INFO, "Taskline started with {0} recurring definition(s)", recurring.definitions().size());
  }

  /**
   * Pauses both loops. Running jobs finish; {@link #start()} resumes.
   */
  public synchronized void stop() {
    recurring.stop();
    scheduler.stop();
  }

  public boolean isRunning() {
    return scheduler.isRunning();
  }

  /**
   * Shuts down components in order: recurring registry, scheduler, refresh manager, and a
   * closeable metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      recurring.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (refreshManager != null) {
      try {
        refreshManager.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Taskline}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private RecurringRunStore runStore;
    private HandlerRegistry handlerRegistry;
    private TokenRefreshManager refreshManager;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private MetricsExporter metrics;
    private String workerId;
    private int workerCount = 4;
    private int batchSize = 50;
    private long intervalMs = 5000;
    private long recurringIntervalMs = 60_000;
    private Duration defaultTimeout;
    private final Map<String, Duration> timeouts = new LinkedHashMap<>();
    private Duration staleClaimTimeout;
    private long drainTimeoutMs = 5000;
    private final List<RecurringJobDefinition> definitions = new ArrayList<>();
    private final AtomicBoolean built = new AtomicBoolean(false);

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
     * <b>Required.</b>
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder runStore(RecurringRunStore runStore) {
      this.runStore = runStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets a refresh manager to be closed together with this instance.
     *
     * <p>Optional.
     */
    public Builder refreshManager(TokenRefreshManager refreshManager) {
      this.refreshManager = refreshManager;
      return this;
    }

    /**
     * Optional. Defaults to {@link io.taskline.scheduler.ExponentialBackoffRetryPolicy}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
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
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with this instance if it
     * implements {@link AutoCloseable}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Optional. Defaults to {@code 4}.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 50}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the scheduler tick interval.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets the recurring registry tick interval.
     *
     * <p>Optional. Defaults to {@code 60000} ms.
     */
    public Builder recurringIntervalMs(long recurringIntervalMs) {
      this.recurringIntervalMs = recurringIntervalMs;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes.
     */
    public Builder defaultTimeout(Duration defaultTimeout) {
      this.defaultTimeout = defaultTimeout;
      return this;
    }

    public Builder timeout(JobType jobType, Duration timeout) {
      this.timeouts.put(Objects.requireNonNull(jobType, "jobType").key(), timeout);
      return this;
    }

    public Builder timeout(String jobType, Duration timeout) {
      this.timeouts.put(Objects.requireNonNull(jobType, "jobType"), timeout);
      return this;
    }

    /**
     * Optional. Defaults to 30 minutes.
     */
    public Builder staleClaimTimeout(Duration staleClaimTimeout) {
      this.staleClaimTimeout = staleClaimTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder definition(RecurringJobDefinition definition) {
      this.definitions.add(Objects.requireNonNull(definition, "definition"));
      return this;
    }

    public Builder definitions(Collection<RecurringJobDefinition> definitions) {
      definitions.forEach(this::definition);
      return this;
    }

    /**
     * Builds the registry and scheduler. If scheduler construction fails, the registry
     * is closed before rethrowing.
     *
     * @throws IllegalStateException if a recurring job type has no handler, or build()
     *     was already called
     */
    public Taskline build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(jobStore, "jobStore");
      Objects.requireNonNull(runStore, "runStore");
      Objects.requireNonNull(handlerRegistry, "handlerRegistry");

      RecurringJobRegistry recurring = RecurringJobRegistry.builder()
          .connectionProvider(connectionProvider)
          .jobStore(jobStore)
          .runStore(runStore)
          .clock(clock)
          .metrics(metrics)
          .definitions(definitions)
          .intervalMs(recurringIntervalMs)
          .build();

      Set<JobType> required = new LinkedHashSet<>();
      for (RecurringJobDefinition definition : definitions) {
        required.add(StringJobType.of(definition.jobType()));
      }

      JobScheduler scheduler;
      try {
        JobScheduler.Builder sb = JobScheduler.builder()
            .connectionProvider(connectionProvider)
            .jobStore(jobStore)
            .handlerRegistry(handlerRegistry)
            .retryPolicy(retryPolicy)
            .clock(clock)
            .metrics(metrics)
            .workerId(workerId)
            .workerCount(workerCount)
            .batchSize(batchSize)
            .intervalMs(intervalMs)
            .drainTimeoutMs(drainTimeoutMs)
            .requireHandlers(required);
        if (defaultTimeout != null) {
          sb.defaultTimeout(defaultTimeout);
        }
        if (staleClaimTimeout != null) {
          sb.staleClaimTimeout(staleClaimTimeout);
        }
        timeouts.forEach(sb::timeout);
        scheduler = sb.build();
      } catch (RuntimeException e) {
        recurring.close();
        throw e;
      }
      return new Taskline(scheduler, recurring, refreshManager, metrics);
    }
  }
}
