package livefeed;

/**
 * Client-visible error codes carried in {@code error} frames.
 */
public enum ApiErrorCode {
  /** Malformed frame, or input rejected by a handler's validation. */
  BAD_INPUT,
  /** Unknown subscription path, or unsubscribe for an id with no subscription. */
  NOT_FOUND,
  /** Duplicate subscription id, or a uniqueness violation in the store. */
  ALREADY_EXISTS,
  /** The account may not see the requested resource. */
  UNAUTHORIZED,
  /** Any non-domain failure. */
  UNKNOWN
}
