/**
 * JDBC building blocks shared by the stores: {@link io.taskline.jdbc.JdbcTemplate},
 * {@link io.taskline.jdbc.TableNames} and
 * {@link io.taskline.jdbc.DataSourceConnectionProvider}.
 *
 * <p>Reference schemas for H2, MySQL and PostgreSQL ship as classpath resources under
 * {@code schema/}.
 *
 * @see io.taskline.jdbc.store
 * @see io.taskline.jdbc.purge
 */
package io.taskline.jdbc;
