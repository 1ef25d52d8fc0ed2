package livefeed.context;

import livefeed.SqlQuery;

import java.util.List;
import java.util.Optional;

/**
 * Query access bound to one borrowed store connection and one transaction.
 *
 * <p>A context is single-use. Once its transaction commits or rolls back every method
 * throws {@link IllegalStateException}; callers must not retain it past their action.
 */
public interface QueryContext {

  /**
   * Runs a query and maps every row.
   *
   * @throws IllegalStateException if the context has been invalidated
   */
  <T> List<T> query(SqlQuery query, RowMapper<T> mapper);

  /**
   * Runs a query and maps the first row, if any.
   *
   * @throws IllegalStateException if the context has been invalidated
   */
  <T> Optional<T> queryOne(SqlQuery query, RowMapper<T> mapper);

  /**
   * Runs an insert, update or delete.
   *
   * @return rows affected
   * @throws IllegalStateException if the context has been invalidated
   */
  int update(SqlQuery query);

  /**
   * Registers a hook that runs after a successful commit, with this context already
   * invalidated. Hooks never run when the transaction rolls back.
   *
   * @throws IllegalStateException if the context has been invalidated
   */
  void afterCommit(Runnable hook);
}
