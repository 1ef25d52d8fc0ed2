package livefeed.session;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe table of subscription paths.
 *
 * <pre>{@code
 * SubscriptionRouter router = new SubscriptionRouter()
 *     .register("/comment/watchPostComments",
 *         InputReader.json(mapper, WatchPostComments.class),
 *         commentHandlers::watchPostComments);
 * }</pre>
 */
public final class SubscriptionRouter {
  private final Map<String, SubscriptionRoute<?>> routes = new ConcurrentHashMap<>();

  /**
   * @return this router for chaining
   * @throws IllegalArgumentException if {@code path} is already registered
   */
  public <I> SubscriptionRouter register(String path, InputReader<I> reader, SubscriptionHandler<I> handler) {
    return register(new SubscriptionRoute<>(path, reader, handler));
  }

  /**
   * @return this router for chaining
   * @throws IllegalArgumentException if the route's path is already registered
   */
  public SubscriptionRouter register(SubscriptionRoute<?> route) {
    if (routes.putIfAbsent(route.path(), route) != null) {
      throw new IllegalArgumentException("Subscription path already registered: " + route.path());
    }
    return this;
  }

  public Optional<SubscriptionRoute<?>> route(String path) {
    return Optional.ofNullable(routes.get(path));
  }

  public Set<String> paths() {
    return Collections.unmodifiableSet(routes.keySet());
  }
}
