package io.taskline.spi;

import io.taskline.model.OAuthState;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence contract for pending OAuth {@code state} values.
 *
 * @see io.taskline.jdbc.store.JdbcOAuthStateStore
 */
public interface OAuthStateStore {

    void insert(Connection conn, OAuthState state);

    /**
     * Removes and returns the state. Only one caller can consume a given state.
     *
     * @return the consumed state, or empty if it did not exist or was consumed concurrently
     */
    Optional<OAuthState> consume(Connection conn, String state);

    /**
     * Deletes states with {@code expires_at <= now}.
     *
     * @return the number of rows deleted
     */
    int purgeExpired(Connection conn, Instant now);
}
