/**
 * JDBC-based {@link io.taskline.spi.JobPurger} implementations for age-based
 * deletion of terminal jobs.
 *
 * <p>{@link io.taskline.jdbc.purge.AbstractJdbcJobPurger} provides a default
 * subquery-based {@code DELETE} that works for H2 and PostgreSQL.
 * {@link io.taskline.jdbc.purge.MySqlJobPurger} overrides with
 * {@code DELETE...ORDER BY...LIMIT}.
 */
package io.taskline.jdbc.purge;
