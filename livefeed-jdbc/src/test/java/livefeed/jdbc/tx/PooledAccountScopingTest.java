package livefeed.jdbc.tx;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import livefeed.AccountId;
import livefeed.SqlQuery;
import livefeed.jdbc.DataSourceConnectionProvider;
import livefeed.jdbc.dialect.H2Dialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * With a single pooled connection every transaction reuses the same physical session, so any
 * account binding left behind would be visible to the next borrower.
 */
class PooledAccountScopingTest {
  private HikariDataSource pool;
  private JdbcContexts contexts;

  @BeforeEach
  void setUp() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:pool_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(1);
    config.setMinimumIdle(1);
    config.setPoolName("livefeed-test-pool");
    pool = new HikariDataSource(config);
    contexts = new JdbcContexts(new DataSourceConnectionProvider(pool), new H2Dialect());
  }

  @AfterEach
  void tearDown() {
    pool.close();
  }

  private Optional<Long> currentAccount() {
    return contexts.withUnauthorized(ctx -> ctx.queryOne(
        SqlQuery.of("SELECT " + H2Dialect.ACCOUNT_VARIABLE), rs -> rs.getObject(1, Long.class)));
  }

  @Test
  void accountDoesNotLeakToNextBorrower() {
    Long inside = contexts.withAuthorized(AccountId.of(7), ctx -> ctx.queryOne(
        SqlQuery.of("SELECT " + H2Dialect.ACCOUNT_VARIABLE), rs -> rs.getObject(1, Long.class)).orElse(null));

    assertEquals(7L, inside);
    assertTrue(currentAccount().isEmpty());
  }

  @Test
  void accountDoesNotLeakAfterRollback() {
    assertThrows(IllegalStateException.class, () -> contexts.withAuthorized(AccountId.of(7), ctx -> {
      throw new IllegalStateException("abort");
    }));

    assertTrue(currentAccount().isEmpty());
  }

  @Test
  void connectionReturnsToPoolInAutoCommitMode() throws Exception {
    contexts.withAuthorized(AccountId.of(5), ctx -> ctx.queryOne(SqlQuery.of("SELECT 1"), rs -> rs.getInt(1)));

    try (Connection conn = pool.getConnection()) {
      assertTrue(conn.getAutoCommit());
    }
    assertEquals(0, pool.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void sequentialAccountsSeeOnlyTheirOwn() {
    for (long id = 1; id <= 5; id++) {
      long expected = id;
      Long seen = contexts.withAuthorized(AccountId.of(id), ctx -> ctx.queryOne(
          SqlQuery.of("SELECT " + H2Dialect.ACCOUNT_VARIABLE), rs -> rs.getObject(1, Long.class)).orElse(null));
      assertEquals(expected, seen);
    }
  }
}
