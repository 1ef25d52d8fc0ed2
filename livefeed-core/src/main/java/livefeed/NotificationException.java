package livefeed;

/**
 * Thrown when the notification feed cannot listen, unlisten or send.
 */
public class NotificationException extends RuntimeException {

  public NotificationException(String message) {
    super(message);
  }

  public NotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
