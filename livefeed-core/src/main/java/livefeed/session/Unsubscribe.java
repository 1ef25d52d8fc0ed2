package livefeed.session;

/**
 * Tears down one subscription: typically unlistens from the channel registry.
 */
@FunctionalInterface
public interface Unsubscribe {

  Unsubscribe NOOP = () -> {
  };

  void unsubscribe() throws Exception;
}
