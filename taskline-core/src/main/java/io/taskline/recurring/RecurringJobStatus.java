package io.taskline.recurring;

import java.time.Instant;

/**
 * Snapshot of one recurring definition.
 *
 * @param definitionId the definition id
 * @param cadence      the cadence in {@link CadenceRule#describe()} form
 * @param jobType      job type key of the enqueued jobs
 * @param lastRunTime  last enqueue (or registration) time, {@code null} if never seen
 * @param nextDue      next due time, {@code null} if never seen
 */
public record RecurringJobStatus(
    String definitionId,
    String cadence,
    String jobType,
    Instant lastRunTime,
    Instant nextDue) {
}
