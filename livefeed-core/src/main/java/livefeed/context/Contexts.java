package livefeed.context;

import livefeed.AccountId;

/**
 * Entry point for all access to persisted state.
 *
 * <p>Each call borrows one connection, runs {@code action} in a fresh transaction, commits on
 * success and rolls back on any exception, then releases the connection. The exception thrown
 * by {@code action} propagates unchanged. After-commit hooks run only after a successful commit.
 */
public interface Contexts {

  <T, E extends Exception> T withUnauthorized(ContextAction<UnauthorizedContext, T, E> action) throws E;

  /**
   * Like {@link #withUnauthorized}, but binds {@code accountId} into the store session for the
   * duration of the transaction before running {@code action}.
   */
  <T, E extends Exception> T withAuthorized(AccountId accountId,
      ContextAction<AuthorizedContext, T, E> action) throws E;
}
