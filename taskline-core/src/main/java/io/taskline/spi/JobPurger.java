package io.taskline.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes terminal jobs (COMPLETED, FAILED, CANCELLED) older than a cutoff.
 *
 * <p>Job rows are kept after reaching a terminal status so their result or final
 * error stays queryable; this purge bounds that retention.
 *
 * @see io.taskline.jdbc.purge.AbstractJdbcJobPurger
 */
public interface JobPurger {

    /**
     * Deletes terminal jobs whose completion (or creation, if never executed) is before the cutoff.
     *
     * @param conn   the JDBC connection (caller controls transaction)
     * @param before delete jobs where {@code COALESCE(executed_at, cancelled_at, created_at) < before}
     * @param limit  maximum number of rows to delete in this batch
     * @return the number of rows actually deleted
     */
    int purge(Connection conn, Instant before, int limit);
}
