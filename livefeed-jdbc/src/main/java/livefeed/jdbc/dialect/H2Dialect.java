package livefeed.jdbc.dialect;

import livefeed.AccountId;
import livefeed.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>H2 has no transaction-scoped settings, so the account goes into a session variable that
 * {@link #releaseAccount} resets before the connection returns to the pool.
 */
public final class H2Dialect implements Dialect {
  public static final String ACCOUNT_VARIABLE = "@LIVEFEED_ACCOUNT_ID";

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public void bindAccount(Connection conn, AccountId accountId) throws SQLException {
    // value is a validated long, never caller text
    long value = accountId.value();
    try (Statement statement = conn.createStatement()) {
      statement.execute("SET " + ACCOUNT_VARIABLE + " = CAST(" + value + " AS BIGINT)");
    }
  }

  @Override
  public void releaseAccount(Connection conn) throws SQLException {
    try (Statement statement = conn.createStatement()) {
      statement.execute("SET " + ACCOUNT_VARIABLE + " = CAST(NULL AS BIGINT)");
    }
  }

  @Override
  public String currentAccountSql() {
    return ACCOUNT_VARIABLE;
  }
}
