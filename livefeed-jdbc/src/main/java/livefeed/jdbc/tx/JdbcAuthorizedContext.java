package livefeed.jdbc.tx;

import livefeed.AccountId;
import livefeed.context.AuthorizedContext;

import java.sql.Connection;

final class JdbcAuthorizedContext extends JdbcQueryContext implements AuthorizedContext {
  private final AccountId accountId;

  JdbcAuthorizedContext(Connection connection, AccountId accountId) {
    super(connection);
    this.accountId = accountId;
  }

  @Override
  public AccountId accountId() {
    return accountId;
  }
}
