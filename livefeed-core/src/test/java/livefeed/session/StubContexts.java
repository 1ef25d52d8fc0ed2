package livefeed.session;

import livefeed.AccountId;
import livefeed.SqlQuery;
import livefeed.context.AuthorizedContext;
import livefeed.context.ContextAction;
import livefeed.context.Contexts;
import livefeed.context.RowMapper;
import livefeed.context.UnauthorizedContext;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Contexts without a store. Records the accounts it was asked to authorize; queries return nothing.
 */
public final class StubContexts implements Contexts {
  private final List<AccountId> authorized = new CopyOnWriteArrayList<>();

  @Override
  public <T, E extends Exception> T withUnauthorized(ContextAction<UnauthorizedContext, T, E> action) throws E {
    return action.run(new EmptyContext(null));
  }

  @Override
  public <T, E extends Exception> T withAuthorized(AccountId accountId,
      ContextAction<AuthorizedContext, T, E> action) throws E {
    authorized.add(accountId);
    return action.run(new EmptyContext(accountId));
  }

  public List<AccountId> authorized() {
    return authorized;
  }

  private static final class EmptyContext implements AuthorizedContext {
    private final AccountId accountId;

    private EmptyContext(AccountId accountId) {
      this.accountId = accountId;
    }

    @Override
    public AccountId accountId() {
      return accountId;
    }

    @Override
    public <T> List<T> query(SqlQuery query, RowMapper<T> mapper) {
      return List.of();
    }

    @Override
    public <T> Optional<T> queryOne(SqlQuery query, RowMapper<T> mapper) {
      return Optional.empty();
    }

    @Override
    public int update(SqlQuery query) {
      return 0;
    }

    @Override
    public void afterCommit(Runnable hook) {
      hook.run();
    }
  }
}
