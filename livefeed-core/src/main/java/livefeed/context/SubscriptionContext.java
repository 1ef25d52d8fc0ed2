package livefeed.context;

import livefeed.AccountId;

/**
 * Long-lived context handed to a subscription handler. It lives as long as the subscription,
 * not any single transaction.
 *
 * <p>Handlers read through {@link #withAuthorized} and deliver through {@link #publish};
 * they never touch the underlying connection or socket.
 *
 * @param <M> message type
 */
public interface SubscriptionContext<M> {

  AccountId accountId();

  /**
   * Sends a message to the subscribing client. Dropped once the subscription has been
   * unsubscribed or its session closed.
   */
  void publish(M message);

  /**
   * Runs {@code action} in a short-lived transaction authorized as {@link #accountId()}.
   */
  <T, E extends Exception> T withAuthorized(ContextAction<AuthorizedContext, T, E> action) throws E;

  /** Returns {@code false} once the subscription has been torn down. */
  boolean isActive();
}
