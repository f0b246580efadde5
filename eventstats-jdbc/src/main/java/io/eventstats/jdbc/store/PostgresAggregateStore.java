package io.eventstats.jdbc.store;

import io.eventstats.jdbc.JdbcTemplate;
import io.eventstats.model.AggregateRecord;
import io.eventstats.spi.ConnectionProvider;
import io.eventstats.spi.StoreUnavailableException;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL aggregate store.
 *
 * <p>Uses {@code INSERT ... ON CONFLICT DO UPDATE ... RETURNING} so the increment and the
 * read-back are a single round-trip.
 */
public final class PostgresAggregateStore extends AbstractJdbcAggregateStore {

  public PostgresAggregateStore() {
    super();
  }

  public PostgresAggregateStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  protected AbstractJdbcAggregateStore newInstance(ConnectionProvider connectionProvider, String tableName) {
    return new PostgresAggregateStore(connectionProvider, tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected AggregateRecord incrementInTransaction(Connection conn, String eventType, double amount) {
    String sql = "INSERT INTO " + tableName() + " AS s (event_type, event_count, value_sum) VALUES (?, 1, ?)" +
        " ON CONFLICT (event_type) DO UPDATE" +
        " SET event_count = s.event_count + 1, value_sum = s.value_sum + EXCLUDED.value_sum" +
        " RETURNING event_type, event_count, value_sum";
    List<AggregateRecord> rows = JdbcTemplate.updateReturning(conn, sql, RECORD_ROW_MAPPER, eventType, amount);
    if (rows.isEmpty()) {
      throw new StoreUnavailableException("Upsert of " + eventType + " returned no row");
    }
    return rows.get(0);
  }
}
