package livefeed;

import java.util.Objects;

/**
 * Domain error with a client-visible {@link ApiErrorCode}.
 *
 * <p>Thrown by handlers, input readers and the store error translation; the subscription
 * session converts it into an {@code error} frame without closing the connection.
 */
public class ApiException extends RuntimeException {
  private final ApiErrorCode code;

  public ApiException(ApiErrorCode code) {
    this(code, code.name(), null);
  }

  public ApiException(ApiErrorCode code, String message) {
    this(code, message, null);
  }

  public ApiException(ApiErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ApiErrorCode code() {
    return code;
  }
}
