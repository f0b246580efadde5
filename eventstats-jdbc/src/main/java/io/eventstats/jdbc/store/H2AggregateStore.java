package io.eventstats.jdbc.store;

import io.eventstats.spi.ConnectionProvider;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 aggregate store. Primarily for testing and single-node runs.
 *
 * <p>Uses the default update-then-insert increment from {@link AbstractJdbcAggregateStore}.
 */
public final class H2AggregateStore extends AbstractJdbcAggregateStore {
  // org.h2.api.ErrorCode.CONCURRENT_UPDATE_1 and LOCK_TIMEOUT_1
  private static final int CONCURRENT_UPDATE = 90131;
  private static final int LOCK_TIMEOUT = 50200;

  public H2AggregateStore() {
    super();
  }

  public H2AggregateStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  protected AbstractJdbcAggregateStore newInstance(ConnectionProvider connectionProvider, String tableName) {
    return new H2AggregateStore(connectionProvider, tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected boolean isRetryable(SQLException e) {
    return super.isRetryable(e) || e.getErrorCode() == CONCURRENT_UPDATE || e.getErrorCode() == LOCK_TIMEOUT;
  }
}
