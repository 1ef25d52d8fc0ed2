package livefeed.session;

import java.util.Objects;

/**
 * A subscription path with its input reader and handler.
 */
public record SubscriptionRoute<I>(String path, InputReader<I> reader, SubscriptionHandler<I> handler) {

  public SubscriptionRoute {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(handler, "handler");
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/': " + path);
    }
  }
}
