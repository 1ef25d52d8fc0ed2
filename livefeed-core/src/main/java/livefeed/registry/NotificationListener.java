package livefeed.registry;

/**
 * Callback invoked for each notification on a channel.
 *
 * <p>Each listener runs on its own serial lane: it sees a channel's notifications in store
 * order, and a slow or failing listener does not hold up its siblings. Exceptions are logged
 * by the registry and otherwise ignored.
 *
 * @param <P> payload type
 */
@FunctionalInterface
public interface NotificationListener<P> {
  void onNotification(P payload) throws Exception;
}
