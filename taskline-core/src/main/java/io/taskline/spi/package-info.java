/**
 * Service Provider Interfaces (SPI) for persistence, connections and metrics.
 *
 * <p>Store methods receive an explicit {@link java.sql.Connection} so the caller controls
 * transaction boundaries. JDBC implementations live in {@code taskline-jdbc}.
 *
 * @see io.taskline.spi.ConnectionProvider
 * @see io.taskline.spi.JobStore
 * @see io.taskline.spi.JobPurger
 * @see io.taskline.spi.CredentialStore
 * @see io.taskline.spi.RecurringRunStore
 * @see io.taskline.spi.OAuthStateStore
 * @see io.taskline.spi.MetricsExporter
 */
package io.taskline.spi;
