package livefeed.session;

import livefeed.context.SubscriptionContext;

/**
 * Domain logic behind one subscription path.
 *
 * <p>A handler authorizes the request through {@link SubscriptionContext#withAuthorized},
 * registers a listener with the channel registry, and returns how to tear that down.
 * It delivers messages only through {@link SubscriptionContext#publish}.
 *
 * <p>Throwing {@link livefeed.ApiException} reports its code to the client; any other
 * exception is reported as {@code UNKNOWN}.
 *
 * @param <I> validated input type
 */
@FunctionalInterface
public interface SubscriptionHandler<I> {
  Unsubscribe subscribe(SubscriptionContext<Object> ctx, I input) throws Exception;
}
