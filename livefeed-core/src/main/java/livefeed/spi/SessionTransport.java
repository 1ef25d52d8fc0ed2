package livefeed.spi;

/**
 * The network side of one client connection, as seen by a
 * {@link livefeed.session.SubscriptionSession}.
 */
public interface SessionTransport {

    /** Sends one UTF-8 text frame. Must not block on the network. */
    void send(String frame);

    /** Sends a transport-level ping. */
    void ping();

    /** Forcibly closes the connection; the session is closed by the transport's close path. */
    void terminate();
}
