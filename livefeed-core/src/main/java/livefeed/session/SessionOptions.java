package livefeed.session;

/**
 * Per-deployment session settings.
 *
 * @param exposeServerStack include {@code serverStack} in error frames; off in production
 */
public record SessionOptions(boolean exposeServerStack) {
  public static final SessionOptions DEFAULTS = new SessionOptions(false);
}
