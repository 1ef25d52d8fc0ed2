package livefeed.jdbc;

import livefeed.ApiErrorCode;
import livefeed.ApiException;

import java.sql.SQLException;

/**
 * Maps store errors to domain errors where the distinction matters to clients.
 *
 * <ul>
 *   <li>{@code 23505} unique violation &rarr; {@link ApiErrorCode#ALREADY_EXISTS}</li>
 *   <li>{@code 42501} insufficient privilege (row policy) &rarr; {@link ApiErrorCode#UNAUTHORIZED}</li>
 *   <li>anything else &rarr; {@link DataAccessException}</li>
 * </ul>
 */
public final class SqlErrorTranslator {
  public static final String UNIQUE_VIOLATION = "23505";
  public static final String INSUFFICIENT_PRIVILEGE = "42501";

  private SqlErrorTranslator() {}

  public static RuntimeException translate(String message, SQLException e) {
    String state = e.getSQLState();
    if (UNIQUE_VIOLATION.equals(state)) {
      return new ApiException(ApiErrorCode.ALREADY_EXISTS, message, e);
    }
    if (INSUFFICIENT_PRIVILEGE.equals(state)) {
      return new ApiException(ApiErrorCode.UNAUTHORIZED, message, e);
    }
    return new DataAccessException(message, e);
  }
}
