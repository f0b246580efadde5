package io.eventstats.jdbc.store;

import io.eventstats.jdbc.JdbcTemplate;
import io.eventstats.model.AggregateRecord;
import io.eventstats.model.HealthStatus;
import io.eventstats.spi.AggregateStore;
import io.eventstats.spi.ConnectionProvider;
import io.eventstats.spi.StoreUnavailableException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC aggregate store with standard SQL implementations.
 *
 * <p>The default {@link #incrementInTransaction} is a relative {@code UPDATE}, an
 * {@code INSERT} when no row exists yet, and a retry of the {@code UPDATE} if a concurrent
 * first insert won the race; the row is then read back while its lock is still held.
 * Subclasses override it with single-statement upserts where the database has them.
 *
 * <p>Instances created through the public no-arg constructor are unbound templates, as
 * loaded by {@link JdbcAggregateStores}; bind them with {@link #withConnectionProvider}
 * before use. Register custom implementations via
 * {@code META-INF/services/io.eventstats.jdbc.store.AbstractJdbcAggregateStore}.
 *
 * @see JdbcAggregateStores
 */
public abstract class AbstractJdbcAggregateStore implements AggregateStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcAggregateStore.class.getName());

  protected static final String DEFAULT_TABLE = "event_stats";
  private static final int MAX_TX_ATTEMPTS = 3;

  protected static final JdbcTemplate.RowMapper<AggregateRecord> RECORD_ROW_MAPPER = rs -> new AggregateRecord(
      rs.getString("event_type"),
      rs.getLong("event_count"),
      rs.getDouble("value_sum"));

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  protected AbstractJdbcAggregateStore() {
    this(null, DEFAULT_TABLE);
  }

  protected AbstractJdbcAggregateStore(ConnectionProvider connectionProvider, String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.connectionProvider = connectionProvider;
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Creates a copy of this store bound to the given connection provider and table.
   */
  protected abstract AbstractJdbcAggregateStore newInstance(ConnectionProvider connectionProvider, String tableName);

  /**
   * Returns a copy of this store that obtains connections from {@code connectionProvider}.
   */
  public AbstractJdbcAggregateStore withConnectionProvider(ConnectionProvider connectionProvider) {
    return newInstance(Objects.requireNonNull(connectionProvider, "connectionProvider"), tableName);
  }

  /**
   * Returns a copy of this store that reads and writes {@code tableName}.
   */
  public AbstractJdbcAggregateStore withTableName(String tableName) {
    return newInstance(connectionProvider, tableName);
  }

  public String tableName() {
    return tableName;
  }

  protected ConnectionProvider connectionProvider() {
    if (connectionProvider == null) {
      throw new IllegalStateException("No ConnectionProvider bound to " + name() +
          " store; call withConnectionProvider(...) first");
    }
    return connectionProvider;
  }

  @Override
  public AggregateRecord increment(String eventType, double amount) {
    Objects.requireNonNull(eventType, "eventType");
    if (!Double.isFinite(amount)) {
      throw new IllegalArgumentException("amount must be finite, got: " + amount);
    }
    return inTransaction("increment " + eventType, conn -> incrementInTransaction(conn, eventType, amount));
  }

  /**
   * Applies {@code count += 1, sum += amount} inside the caller's transaction and returns the
   * updated row. The connection has auto-commit disabled.
   */
  protected AggregateRecord incrementInTransaction(Connection conn, String eventType, double amount) {
    if (updateExisting(conn, eventType, amount) == 0) {
      try {
        JdbcTemplate.update(conn, "INSERT INTO " + tableName() +
            " (event_type, event_count, value_sum) VALUES (?, 1, ?)", eventType, amount);
      } catch (StoreUnavailableException e) {
        if (!isDuplicateKey(JdbcTemplate.sqlCause(e))) {
          throw e;
        }
        // Another transaction inserted the row first; it is committed now.
        if (updateExisting(conn, eventType, amount) == 0) {
          throw e;
        }
      }
    }
    return selectRecord(conn, eventType)
        .orElseThrow(() -> new StoreUnavailableException("Row for " + eventType + " vanished after increment"));
  }

  private int updateExisting(Connection conn, String eventType, double amount) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName() +
        " SET event_count = event_count + 1, value_sum = value_sum + ? WHERE event_type = ?",
        amount, eventType);
  }

  protected Optional<AggregateRecord> selectRecord(Connection conn, String eventType) {
    List<AggregateRecord> rows = JdbcTemplate.query(conn,
        "SELECT event_type, event_count, value_sum FROM " + tableName() + " WHERE event_type = ?",
        RECORD_ROW_MAPPER, eventType);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public Optional<AggregateRecord> get(String eventType) {
    Objects.requireNonNull(eventType, "eventType");
    try (Connection conn = connectionProvider().getConnection()) {
      return selectRecord(conn, eventType);
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to read aggregate " + eventType, e);
    }
  }

  @Override
  public Map<String, AggregateRecord> getAll() {
    try (Connection conn = connectionProvider().getConnection()) {
      List<AggregateRecord> rows = JdbcTemplate.query(conn,
          "SELECT event_type, event_count, value_sum FROM " + tableName() + " ORDER BY event_type",
          RECORD_ROW_MAPPER);
      // Re-sorted in Java so ordering does not depend on the database collation.
      Map<String, AggregateRecord> result = new TreeMap<>();
      for (AggregateRecord row : rows) {
        result.put(row.eventType(), row);
      }
      return Collections.unmodifiableMap(result);
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to read aggregates", e);
    }
  }

  @Override
  public void reset() {
    int removed = inTransaction("reset", conn -> JdbcTemplate.update(conn, "DELETE FROM " + tableName()));
    logger.log(Level.INFO, "Reset {0} aggregate(s) in {1}", new Object[]{removed, tableName()});
  }

  @Override
  public HealthStatus healthCheck() {
    try (Connection conn = connectionProvider().getConnection()) {
      JdbcTemplate.query(conn, "SELECT event_type FROM " + tableName() + " WHERE 1 = 0", rs -> rs.getString(1));
      return HealthStatus.HEALTHY;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.FINE, "Aggregate store health check failed", e);
      return HealthStatus.UNHEALTHY;
    }
  }

  /**
   * Whether a failed transaction may succeed if run again (deadlock, serialization failure).
   */
  protected boolean isRetryable(SQLException e) {
    if (e instanceof SQLTransientException) {
      return true;
    }
    String state = e.getSQLState();
    return "40001".equals(state) || "40P01".equals(state);
  }

  /**
   * Whether the failure is a unique-key violation.
   */
  protected boolean isDuplicateKey(SQLException e) {
    return e != null && e.getSQLState() != null && e.getSQLState().startsWith("23");
  }

  @FunctionalInterface
  protected interface TxWork<T> {
    T run(Connection conn);
  }

  protected <T> T inTransaction(String operation, TxWork<T> work) {
    for (int attempt = 1; ; attempt++) {
      try (Connection conn = connectionProvider().getConnection()) {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
          T result = work.run(conn);
          conn.commit();
          return result;
        } catch (RuntimeException e) {
          rollback(conn, e);
          SQLException sql = JdbcTemplate.sqlCause(e);
          if (sql == null || !isRetryable(sql) || attempt >= MAX_TX_ATTEMPTS) {
            throw e instanceof StoreUnavailableException ? e
                : new StoreUnavailableException("Failed to " + operation, e);
          }
          logger.log(Level.FINE, "Retrying " + operation + " after transient failure (attempt " + attempt + ")", e);
        } finally {
          conn.setAutoCommit(autoCommit);
        }
      } catch (SQLException e) {
        throw new StoreUnavailableException("Failed to " + operation, e);
      }
    }
  }

  private static void rollback(Connection conn, RuntimeException failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }
}
