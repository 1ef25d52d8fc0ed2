package livefeed.netty;

import livefeed.AccountId;
import livefeed.session.SubscriptionSession;
import livefeed.spi.SessionTransport;

/** Creates the session for a connection whose handshake just completed. */
@FunctionalInterface
interface SessionFactory {
  SubscriptionSession create(AccountId accountId, SessionTransport transport);
}
