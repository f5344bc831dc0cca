package io.taskline.spi;

import io.taskline.model.Job;
import io.taskline.model.JobError;
import io.taskline.model.JobQuery;
import io.taskline.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for jobs and their state machine:
 *
 * <pre>
 * PENDING --claim--> PROCESSING --complete--> COMPLETED
 *                    PROCESSING --fail (attempts &lt; max, retryable)--> PENDING
 *                    PROCESSING --fail (otherwise)--> FAILED
 * PENDING --cancel--> CANCELLED
 * </pre>
 *
 * <p>Every transition is a compare-and-set on the current status: an update whose
 * precondition no longer holds changes nothing and reports {@code 0} rows.
 * COMPLETED, FAILED and CANCELLED are terminal.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code taskline-jdbc} module.
 *
 * @see io.taskline.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

    /**
     * Inserts a job. The job's status is stored as given (normally PENDING).
     *
     * @param conn the JDBC connection
     * @param job  the job to persist
     */
    void insert(Connection conn, Job job);

    /**
     * Claims up to {@code limit} due jobs for execution.
     *
     * <p>Selects PENDING jobs with {@code scheduled_time <= now}, oldest scheduled time
     * first, and moves each to PROCESSING while incrementing {@code attempts}, in the same
     * operation. Concurrent callers never receive the same job.
     *
     * @param conn     the JDBC connection; multi-statement implementations expect
     *                 auto-commit to be off and the caller to commit
     * @param workerId identifier of the claiming scheduler instance, stored in {@code claimed_by}
     * @param now      current time
     * @param limit    maximum number of jobs to claim
     * @return the claimed jobs as stored after the claim, ordered by scheduled time
     */
    List<Job> claimDue(Connection conn, String workerId, Instant now, int limit);

    /**
     * Moves a PROCESSING job to COMPLETED.
     *
     * @param conn       the JDBC connection
     * @param jobId      the job to complete
     * @param result     handler result text (may be {@code null})
     * @param executedAt completion time
     * @return the number of rows updated (0 or 1)
     */
    int complete(Connection conn, String jobId, String result, Instant executedAt);

    /**
     * Records a failed dispatch of a PROCESSING job.
     *
     * <p>When {@code retryAt} is non-null and the error is retryable, the job returns to
     * PENDING with {@code scheduled_time = retryAt} if {@code attempts < max_attempts},
     * and becomes FAILED otherwise; the check and the write are one atomic update.
     * When {@code retryAt} is null or the error is not retryable, the job becomes FAILED
     * with {@code attempts = max_attempts}.
     *
     * @param conn    the JDBC connection
     * @param jobId   the job that failed
     * @param error   the structured failure, stored as {@code last_error}
     * @param retryAt next eligible run time, or {@code null} to fail terminally
     * @return the number of rows updated (0 or 1)
     */
    int fail(Connection conn, String jobId, JobError error, Instant retryAt);

    /**
     * Moves a PENDING job to CANCELLED. Jobs in any other status are left untouched.
     *
     * @param conn        the JDBC connection
     * @param jobId       the job to cancel
     * @param cancelledAt cancellation time
     * @return the number of rows updated (0 or 1)
     */
    int cancel(Connection conn, String jobId, Instant cancelledAt);

    /**
     * Returns PROCESSING jobs claimed before {@code claimedBefore} to PENDING, or fails them
     * when no attempts remain. Recovers jobs orphaned by a crashed scheduler.
     *
     * @param conn          the JDBC connection
     * @param claimedBefore claims older than this are considered abandoned
     * @param error         the failure recorded as {@code last_error}
     * @return the number of rows updated
     */
    int releaseStale(Connection conn, Instant claimedBefore, JobError error);

    /**
     * Finds a job by id.
     *
     * @param conn  the JDBC connection
     * @param jobId the job id
     * @return the job, or empty if it does not exist
     */
    Optional<Job> findById(Connection conn, String jobId);

    /**
     * Lists jobs matching the query, newest scheduled time first.
     *
     * @param conn  the JDBC connection
     * @param query owner, status and type filters plus a row limit
     * @return matching jobs
     */
    List<Job> query(Connection conn, JobQuery query);

    /**
     * Counts jobs per status. Statuses without jobs may be absent from the map.
     *
     * @param conn the JDBC connection
     * @return job counts keyed by status
     */
    Map<JobStatus, Long> countByStatus(Connection conn);
}
