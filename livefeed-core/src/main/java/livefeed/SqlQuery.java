package livefeed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameterized SQL text. Parameters are always bound, never concatenated into {@link #sql()}.
 *
 * @param sql statement text with {@code ?} placeholders
 * @param params parameter values in placeholder order; may contain nulls
 */
public record SqlQuery(String sql, List<Object> params) {

  public SqlQuery {
    Objects.requireNonNull(sql, "sql");
    params = params == null
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlQuery of(String sql, Object... params) {
    return new SqlQuery(sql, params == null ? null : Arrays.asList(params));
  }
}
