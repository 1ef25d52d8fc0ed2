package livefeed.jdbc.spi;

import livefeed.AccountId;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support: how an account is bound into a transaction.
 *
 * <p>Register custom dialects via {@code META-INF/services/livefeed.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see livefeed.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Binds {@code accountId} into the store session so row policies see it. Called after
   * auto-commit has been disabled and before any query of the transaction. The binding must not
   * outlive the transaction, either because the store scopes it to the transaction or because
   * {@link #releaseAccount} clears it.
   */
  void bindAccount(Connection conn, AccountId accountId) throws SQLException;

  /**
   * Clears any account binding that the store does not scope to the transaction. Called before
   * the connection is released. Default does nothing.
   */
  default void releaseAccount(Connection conn) throws SQLException {
  }

  /**
   * SQL expression yielding the bound account id as a number, or {@code NULL} when none is
   * bound. Used to write account-scoped queries and row policies.
   */
  String currentAccountSql();
}
