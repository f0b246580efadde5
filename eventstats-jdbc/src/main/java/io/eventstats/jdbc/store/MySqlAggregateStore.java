package io.eventstats.jdbc.store;

import io.eventstats.jdbc.JdbcTemplate;
import io.eventstats.model.AggregateRecord;
import io.eventstats.spi.ConnectionProvider;
import io.eventstats.spi.StoreUnavailableException;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL aggregate store. Also compatible with TiDB.
 *
 * <p>Uses {@code INSERT ... ON DUPLICATE KEY UPDATE}, then reads the row back in the same
 * transaction. The upsert leaves the row locked until commit, so the read sees exactly
 * this transaction's result.
 */
public final class MySqlAggregateStore extends AbstractJdbcAggregateStore {

  public MySqlAggregateStore() {
    super();
  }

  public MySqlAggregateStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  protected AbstractJdbcAggregateStore newInstance(ConnectionProvider connectionProvider, String tableName) {
    return new MySqlAggregateStore(connectionProvider, tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected AggregateRecord incrementInTransaction(Connection conn, String eventType, double amount) {
    JdbcTemplate.update(conn, "INSERT INTO " + tableName() +
        " (event_type, event_count, value_sum) VALUES (?, 1, ?)" +
        " ON DUPLICATE KEY UPDATE event_count = event_count + 1, value_sum = value_sum + ?",
        eventType, amount, amount);
    List<AggregateRecord> rows = JdbcTemplate.query(conn,
        "SELECT event_type, event_count, value_sum FROM " + tableName() + " WHERE event_type = ? FOR UPDATE",
        RECORD_ROW_MAPPER, eventType);
    if (rows.isEmpty()) {
      throw new StoreUnavailableException("Upsert of " + eventType + " left no row");
    }
    return rows.get(0);
  }
}
