package livefeed.jdbc.tx;

import livefeed.SqlQuery;
import livefeed.context.RowMapper;
import livefeed.context.UnauthorizedContext;
import livefeed.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Query context over one borrowed connection. Invalidated by {@link JdbcContexts} before the
 * transaction ends; every method fails after that.
 */
class JdbcQueryContext implements UnauthorizedContext {
  private static final Logger logger = Logger.getLogger(JdbcQueryContext.class.getName());

  private final Connection connection;
  private final List<Runnable> afterCommitHooks = new ArrayList<>();
  private volatile boolean valid = true;

  JdbcQueryContext(Connection connection) {
    this.connection = connection;
  }

  @Override
  public <T> List<T> query(SqlQuery query, RowMapper<T> mapper) {
    checkValid();
    return JdbcTemplate.query(connection, Objects.requireNonNull(query, "query"), mapper);
  }

  @Override
  public <T> Optional<T> queryOne(SqlQuery query, RowMapper<T> mapper) {
    List<T> rows = query(query, mapper);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  @Override
  public int update(SqlQuery query) {
    checkValid();
    return JdbcTemplate.update(connection, Objects.requireNonNull(query, "query"));
  }

  @Override
  public void afterCommit(Runnable hook) {
    checkValid();
    afterCommitHooks.add(Objects.requireNonNull(hook, "hook"));
  }

  void invalidate() {
    valid = false;
  }

  /** Runs hooks in registration order; a failing hook is logged and the rest still run. */
  void runAfterCommitHooks() {
    for (Runnable hook : afterCommitHooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "After-commit hook failed", e);
      }
    }
    afterCommitHooks.clear();
  }

  private void checkValid() {
    if (!valid) {
      throw new IllegalStateException("Transaction context used after commit or rollback");
    }
  }
}
