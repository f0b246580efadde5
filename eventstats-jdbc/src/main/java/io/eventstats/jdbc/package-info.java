/**
 * JDBC support shared by the aggregate store implementations.
 *
 * <h2>Store Hierarchy</h2>
 * <pre>
 * AggregateStore (interface, eventstats-core)
 *   AbstractJdbcAggregateStore (abstract base; H2-compatible update-then-insert increment)
 *     H2AggregateStore        (default strategy)
 *     PostgresAggregateStore  (INSERT ... ON CONFLICT ... RETURNING)
 *     MySqlAggregateStore     (INSERT ... ON DUPLICATE KEY UPDATE, then SELECT)
 * </pre>
 *
 * <p>Use {@link io.eventstats.jdbc.store.JdbcAggregateStores#detect(javax.sql.DataSource)}
 * to pick the implementation from the JDBC URL. DDL for the default {@code event_stats}
 * table ships as {@code eventstats/schema/<name>.sql} on the classpath.
 *
 * @see io.eventstats.jdbc.store.AbstractJdbcAggregateStore
 * @see io.eventstats.jdbc.store.JdbcAggregateStores
 * @see io.eventstats.jdbc.DataSourceConnectionProvider
 */
package io.eventstats.jdbc;
