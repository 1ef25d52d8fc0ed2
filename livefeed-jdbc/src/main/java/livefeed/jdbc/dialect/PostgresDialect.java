package livefeed.jdbc.dialect;

import livefeed.AccountId;
import livefeed.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL dialect. The account is set with {@code set_config(..., true)}, which the server
 * discards at the end of the transaction.
 */
public final class PostgresDialect implements Dialect {
  public static final String ACCOUNT_SETTING = "livefeed.account_id";

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void bindAccount(Connection conn, AccountId accountId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("SELECT set_config(?, ?, true)")) {
      ps.setString(1, ACCOUNT_SETTING);
      ps.setString(2, Long.toString(accountId.value()));
      ps.execute();
    }
  }

  @Override
  public String currentAccountSql() {
    return "NULLIF(current_setting('" + ACCOUNT_SETTING + "', true), '')::bigint";
  }
}
