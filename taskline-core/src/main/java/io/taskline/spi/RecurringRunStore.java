package io.taskline.spi;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persists the last run time of each recurring job definition, so due times can be
 * recomputed after a restart.
 *
 * @see io.taskline.jdbc.store.JdbcRecurringRunStore
 */
public interface RecurringRunStore {

    /**
     * @return the last run time, or empty if the definition has never been seen
     */
    Optional<Instant> lastRunTime(Connection conn, String definitionId);

    /**
     * Records a definition for the first time.
     */
    void insert(Connection conn, String definitionId, Instant lastRunTime);

    /**
     * Advances the last run time only if it still equals {@code expected}.
     *
     * @return the number of rows updated; {@code 0} means another instance advanced it first
     */
    int advance(Connection conn, String definitionId, Instant expected, Instant lastRunTime);
}
