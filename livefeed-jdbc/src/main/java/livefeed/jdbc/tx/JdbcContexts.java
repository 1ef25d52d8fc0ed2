package livefeed.jdbc.tx;

import livefeed.AccountId;
import livefeed.context.AuthorizedContext;
import livefeed.context.ContextAction;
import livefeed.context.Contexts;
import livefeed.context.UnauthorizedContext;
import livefeed.jdbc.SqlErrorTranslator;
import livefeed.jdbc.spi.Dialect;
import livefeed.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC implementation of {@link Contexts}.
 *
 * <p>Each call borrows a connection, disables auto-commit, binds the account through the
 * {@link Dialect} (authorized calls only), runs the action, invalidates the context, then
 * commits or rolls back. The connection is always returned with auto-commit restored and the
 * account binding cleared. After-commit hooks run once the connection is back in the pool.
 *
 * <pre>{@code
 * Contexts contexts = new JdbcContexts(new DataSourceConnectionProvider(pool), Dialects.detect(pool));
 *
 * long id = contexts.withAuthorized(AccountId.of(7), ctx -> {
 *   ctx.update(SqlQuery.of("INSERT INTO comment(post_id, body) VALUES (?, ?)", postId, body));
 *   ctx.afterCommit(() -> registry.notify(COMMENT_INSERT, event));
 *   return ...;
 * });
 * }</pre>
 *
 * <p>An exception thrown by the action propagates unchanged; a failed rollback is attached to it
 * as suppressed.
 */
public final class JdbcContexts implements Contexts {
  private static final Logger logger = Logger.getLogger(JdbcContexts.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;

  public JdbcContexts(ConnectionProvider connectionProvider, Dialect dialect) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public Dialect dialect() {
    return dialect;
  }

  @Override
  public <T, E extends Exception> T withUnauthorized(ContextAction<UnauthorizedContext, T, E> action) throws E {
    Objects.requireNonNull(action, "action");
    return execute(null, JdbcQueryContext::new, action);
  }

  @Override
  public <T, E extends Exception> T withAuthorized(AccountId accountId,
      ContextAction<AuthorizedContext, T, E> action) throws E {
    Objects.requireNonNull(accountId, "accountId");
    Objects.requireNonNull(action, "action");
    return execute(accountId, conn -> new JdbcAuthorizedContext(conn, accountId), action);
  }

  private <C extends JdbcQueryContext, T, E extends Exception> T execute(
      AccountId accountId, Function<Connection, C> contextFactory, ContextAction<? super C, T, E> action) throws E {
    Connection conn = borrow();
    C context = null;
    T result;
    try {
      begin(conn, accountId);
      context = contextFactory.apply(conn);
      result = action.run(context);
      context.invalidate();
      commit(conn);
    } catch (Throwable t) {
      if (context != null) {
        context.invalidate();
      }
      rollback(conn, t);
      throw t;
    } finally {
      release(conn, accountId);
    }
    context.runAfterCommitHooks();
    return result;
  }

  private Connection borrow() {
    try {
      return connectionProvider.getConnection();
    } catch (SQLException e) {
      throw SqlErrorTranslator.translate("Failed to obtain connection", e);
    }
  }

  private void begin(Connection conn, AccountId accountId) {
    try {
      conn.setAutoCommit(false);
      if (accountId != null) {
        dialect.bindAccount(conn, accountId);
      }
    } catch (SQLException e) {
      throw SqlErrorTranslator.translate("Failed to begin transaction", e);
    }
  }

  private static void commit(Connection conn) {
    try {
      conn.commit();
    } catch (SQLException e) {
      throw SqlErrorTranslator.translate("Failed to commit transaction", e);
    }
  }

  private static void rollback(Connection conn, Throwable cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private void release(Connection conn, AccountId accountId) {
    if (accountId != null) {
      try {
        dialect.releaseAccount(conn);
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to clear account binding before release", e);
      }
    }
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit before release", e);
    }
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to release connection", e);
    }
  }
}
