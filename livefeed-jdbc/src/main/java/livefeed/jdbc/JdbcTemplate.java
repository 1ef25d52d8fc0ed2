package livefeed.jdbc;

import livefeed.SqlQuery;
import livefeed.context.RowMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight JDBC helper behind the transaction contexts. Errors are translated by
 * {@link SqlErrorTranslator}.
 */
public final class JdbcTemplate {
  private static final Logger logger = Logger.getLogger(JdbcTemplate.class.getName());

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, SqlQuery query) {
    logger.log(Level.FINE, "update: {0}", query.sql());
    try (PreparedStatement ps = conn.prepareStatement(query.sql())) {
      bindParams(ps, query.params());
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw SqlErrorTranslator.translate("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, SqlQuery query, RowMapper<T> mapper) {
    logger.log(Level.FINE, "query: {0}", query.sql());
    try (PreparedStatement ps = conn.prepareStatement(query.sql())) {
      bindParams(ps, query.params());
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw SqlErrorTranslator.translate("Failed to execute query", e);
    }
  }

  private static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object param = params.get(i);
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
