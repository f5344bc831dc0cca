package io.taskline.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.taskline.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code taskline.jobs.claimed}: jobs moved to PROCESSING</li>
 *   <li>{@code taskline.jobs.completed}: jobs completed successfully</li>
 *   <li>{@code taskline.jobs.retried}: failed dispatches rescheduled with backoff</li>
 *   <li>{@code taskline.jobs.failed}: jobs moved to FAILED</li>
 *   <li>{@code taskline.jobs.timed_out}: handler invocations that exceeded their timeout</li>
 *   <li>{@code taskline.recurring.enqueued}: jobs enqueued by recurring definitions</li>
 *   <li>{@code taskline.credentials.refreshed}: successful provider refreshes</li>
 *   <li>{@code taskline.credentials.refresh_failed}: transient provider refresh failures</li>
 *   <li>{@code taskline.credentials.revoked}: credentials marked REVOKED</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code taskline.workers.active}: handlers currently executing</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter jobsClaimed;
  private final Counter jobsCompleted;
  private final Counter jobsRetried;
  private final Counter jobsFailed;
  private final Counter jobsTimedOut;
  private final Counter recurringEnqueued;
  private final Counter credentialsRefreshed;
  private final Counter credentialRefreshFailures;
  private final Counter credentialsRevoked;
  private final Gauge activeWorkersGauge;

  private final AtomicInteger activeWorkers = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "taskline"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "taskline");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several schedulers
   * sharing one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "publisher.taskline"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.jobsClaimed = counter(namePrefix + ".jobs.claimed", "Jobs moved from PENDING to PROCESSING");
    this.jobsCompleted = counter(namePrefix + ".jobs.completed", "Jobs completed successfully");
    this.jobsRetried = counter(namePrefix + ".jobs.retried", "Failed dispatches rescheduled for retry");
    this.jobsFailed = counter(namePrefix + ".jobs.failed", "Jobs moved to FAILED");
    this.jobsTimedOut = counter(namePrefix + ".jobs.timed_out", "Handler invocations that timed out");
    this.recurringEnqueued = counter(namePrefix + ".recurring.enqueued", "Jobs enqueued by recurring definitions");
    this.credentialsRefreshed = counter(namePrefix + ".credentials.refreshed", "Successful provider token refreshes");
    this.credentialRefreshFailures = counter(namePrefix + ".credentials.refresh_failed",
        "Provider token refreshes that failed transiently");
    this.credentialsRevoked = counter(namePrefix + ".credentials.revoked", "Credentials marked REVOKED");

    this.activeWorkersGauge = Gauge.builder(namePrefix + ".workers.active", activeWorkers, AtomicInteger::get)
        .description("Handlers currently executing")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementJobsClaimed(int count) {
    if (closed) return;
    jobsClaimed.increment(count);
  }

  @Override
  public void incrementJobsCompleted() {
    if (closed) return;
    jobsCompleted.increment();
  }

  @Override
  public void incrementJobsRetried() {
    if (closed) return;
    jobsRetried.increment();
  }

  @Override
  public void incrementJobsFailed() {
    if (closed) return;
    jobsFailed.increment();
  }

  @Override
  public void incrementJobsTimedOut() {
    if (closed) return;
    jobsTimedOut.increment();
  }

  @Override
  public void incrementRecurringEnqueued() {
    if (closed) return;
    recurringEnqueued.increment();
  }

  @Override
  public void incrementCredentialsRefreshed() {
    if (closed) return;
    credentialsRefreshed.increment();
  }

  @Override
  public void incrementCredentialRefreshFailures() {
    if (closed) return;
    credentialRefreshFailures.increment();
  }

  @Override
  public void incrementCredentialsRevoked() {
    if (closed) return;
    credentialsRevoked.increment();
  }

  @Override
  public void recordActiveWorkers(int activeWorkers) {
    if (closed) return;
    this.activeWorkers.set(activeWorkers);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link io.taskline.Taskline#close()} so a closed scheduler leaves no
   * stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(jobsClaimed, jobsCompleted, jobsRetried, jobsFailed, jobsTimedOut,
        recurringEnqueued, credentialsRefreshed, credentialRefreshFailures, credentialsRevoked,
        activeWorkersGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
