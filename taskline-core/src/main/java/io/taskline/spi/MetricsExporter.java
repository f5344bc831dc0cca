package io.taskline.spi;

/**
 * Observability hook for exporting scheduler and credential counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs moved from PENDING to PROCESSING.
     *
     * @param count number of jobs claimed in one tick
     */
    void incrementJobsClaimed(int count);

    /**
     * Increments the count of jobs completed successfully.
     */
    void incrementJobsCompleted();

    /**
     * Increments the count of failed dispatches that will be retried.
     */
    void incrementJobsRetried();

    /**
     * Increments the count of jobs moved to FAILED.
     */
    void incrementJobsFailed();

    /**
     * Increments the count of handler invocations that exceeded their timeout.
     */
    default void incrementJobsTimedOut() {
    }

    /**
     * Increments the count of jobs enqueued by recurring definitions.
     */
    default void incrementRecurringEnqueued() {
    }

    /**
     * Increments the count of successful provider refresh calls.
     */
    default void incrementCredentialsRefreshed() {
    }

    /**
     * Increments the count of provider refresh calls that failed transiently.
     */
    default void incrementCredentialRefreshFailures() {
    }

    /**
     * Increments the count of credentials marked REVOKED.
     */
    default void incrementCredentialsRevoked() {
    }

    /**
     * Records the number of handlers currently executing.
     *
     * @param activeWorkers busy worker threads
     */
    void recordActiveWorkers(int activeWorkers);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementJobsClaimed(int count) {
        }

        @Override
        public void incrementJobsCompleted() {
        }

        @Override
        public void incrementJobsRetried() {
        }

        @Override
        public void incrementJobsFailed() {
        }

        @Override
        public void recordActiveWorkers(int activeWorkers) {
        }
    }
}
