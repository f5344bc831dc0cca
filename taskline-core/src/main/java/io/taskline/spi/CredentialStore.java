package io.taskline.spi;

import io.taskline.model.Credential;
import io.taskline.model.CredentialStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for OAuth credentials, one per {@code (owner, provider)}.
 *
 * <p>Pure data access. Every write touches a single row in a single statement, so
 * readers never observe an access token paired with another token's expiry.
 *
 * @see io.taskline.jdbc.store.AbstractJdbcCredentialStore
 */
public interface CredentialStore {

    /**
     * @return the credential, or empty if none is stored for the pair
     */
    Optional<Credential> get(Connection conn, String ownerId, String provider);

    /**
     * Inserts the credential, or replaces every attribute of the stored one.
     * Used for initial authorization and re-authorization.
     */
    void upsert(Connection conn, Credential credential);

    /**
     * Replaces tokens, expiry, scope, status and {@code updated_at} of an existing credential.
     *
     * @return the number of rows updated (0 if the credential does not exist)
     */
    int update(Connection conn, Credential credential);

    /**
     * Sets the status of an existing credential.
     *
     * @return the number of rows updated (0 or 1)
     */
    int markStatus(Connection conn, String ownerId, String provider, CredentialStatus status, Instant updatedAt);

    /**
     * Lists ACTIVE and EXPIRING credentials with {@code expires_at <= cutoff}, soonest expiry first.
     *
     * @param conn   the JDBC connection
     * @param cutoff typically {@code now + threshold}
     * @return credentials due for refresh
     */
    List<Credential> listExpiring(Connection conn, Instant cutoff);

    /**
     * Lists every credential of an owner, ordered by provider.
     */
    List<Credential> listByOwner(Connection conn, String ownerId);
}
