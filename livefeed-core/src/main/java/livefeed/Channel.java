package livefeed;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named notification stream in the backing store with the payload type carried on it.
 *
 * <p>Names are restricted to {@code [a-z][a-z0-9_]*} and at most {@value #MAX_NAME_LENGTH}
 * characters so they can be quoted safely as store identifiers. Many logical events may share
 * one channel; the payload disambiguates them.
 *
 * @param name channel name, e.g. {@code comment_insert}
 * @param payloadType Jackson-serializable payload type
 * @param <P> payload type
 */
public record Channel<P>(String name, Class<P> payloadType) {
  public static final int MAX_NAME_LENGTH = 48;

  private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][a-z0-9_]*");

  public Channel {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(payloadType, "payloadType");
    if (!isValidName(name)) {
      throw new IllegalArgumentException("Invalid channel name: '" + name
          + "' (expected [a-z][a-z0-9_]*, at most " + MAX_NAME_LENGTH + " characters)");
    }
  }

  public static <P> Channel<P> of(String name, Class<P> payloadType) {
    return new Channel<>(name, payloadType);
  }

  public static boolean isValidName(String name) {
    return name != null
        && name.length() <= MAX_NAME_LENGTH
        && NAME_PATTERN.matcher(name).matches();
  }
}
