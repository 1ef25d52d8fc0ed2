/**
 * Netty WebSocket transport for subscription sessions.
 *
 * <p>{@link livefeed.netty.SubscriptionServer} is the entry point; {@link livefeed.netty.Authenticator}
 * is the one seam applications implement.
 */
package livefeed.netty;
