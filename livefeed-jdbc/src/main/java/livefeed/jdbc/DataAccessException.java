package livefeed.jdbc;

/**
 * Thrown when a store operation fails for a reason with no client-facing error code.
 */
public class DataAccessException extends RuntimeException {

  public DataAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
