package io.eventstats.jdbc;

import io.eventstats.spi.StoreUnavailableException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {
  private Connection conn;

  @BeforeEach
  void setup() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    conn = ds.getConnection();
    conn.createStatement().execute("CREATE TABLE t (k VARCHAR(10) PRIMARY KEY, n BIGINT, d DOUBLE PRECISION)");
  }

  @AfterEach
  void teardown() throws SQLException {
    conn.close();
  }

  @Test
  void updateAndQueryBindTypedParameters() {
    assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO t (k, n, d) VALUES (?, ?, ?)", "a", 7L, 1.5));

    List<String> rows = JdbcTemplate.query(conn, "SELECT k, n, d FROM t WHERE n = ?",
        rs -> rs.getString("k") + ":" + rs.getLong("n") + ":" + rs.getDouble("d"), 7L);

    assertEquals(List.of("a:7:1.5"), rows);
  }

  @Test
  void sqlFailureIsWrappedWithCause() {
    JdbcTemplate.update(conn, "INSERT INTO t (k, n, d) VALUES (?, ?, ?)", "a", 1L, 0.0);

    StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
        () -> JdbcTemplate.update(conn, "INSERT INTO t (k, n, d) VALUES (?, ?, ?)", "a", 2L, 0.0));

    SQLException cause = JdbcTemplate.sqlCause(ex);
    assertNotNull(cause);
    assertTrue(cause.getSQLState().startsWith("23"), cause.getSQLState());
  }

  @Test
  void sqlCauseIsNullWithoutSqlException() {
    assertNull(JdbcTemplate.sqlCause(new IllegalStateException(new RuntimeException())));
    assertNull(JdbcTemplate.sqlCause(null));
  }
}
