/**
 * JDBC-based store implementations.
 *
 * <p>{@link io.taskline.jdbc.store.AbstractJdbcJobStore} provides shared SQL and row mapping;
 * subclasses supply database-specific claim strategies: H2 (subquery),
 * MySQL ({@code UPDATE...ORDER BY...LIMIT}), and PostgreSQL
 * ({@code FOR UPDATE SKIP LOCKED}). Credential stores differ only in their upsert
 * statement. Recurring run and OAuth state stores are plain SQL.
 *
 * @see io.taskline.jdbc.store.AbstractJdbcJobStore
 * @see io.taskline.jdbc.store.JdbcJobStores
 * @see io.taskline.jdbc.store.AbstractJdbcCredentialStore
 * @see io.taskline.jdbc.store.JdbcRecurringRunStore
 * @see io.taskline.jdbc.store.JdbcOAuthStateStore
 */
package io.taskline.jdbc.store;
