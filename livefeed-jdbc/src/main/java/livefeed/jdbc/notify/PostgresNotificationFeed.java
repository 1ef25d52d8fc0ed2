package livefeed.jdbc.notify;

import livefeed.Channel;
import livefeed.NotificationException;
import livefeed.spi.ConnectionProvider;
import livefeed.spi.NotificationFeed;
import livefeed.spi.NotificationSink;
import livefeed.util.DaemonThreadFactory;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link NotificationFeed} over PostgreSQL {@code LISTEN}/{@code NOTIFY}.
 *
 * <p>Receiving uses exactly one dedicated connection, held for the life of the feed and shared
 * by all channels. A daemon poller thread drains it with {@link PGConnection#getNotifications(int)}.
 * If that connection breaks, the poller logs, waits {@code reconnectDelay}, opens a new one and
 * re-issues {@code LISTEN} for every active channel.
 *
 * <p>Sending runs {@code SELECT pg_notify(?, ?)} on a short-lived auto-committed connection, so a
 * notification never depends on a caller's transaction.
 *
 * <p>Store channel names carry the {@value #CHANNEL_PREFIX} prefix and are quoted identifiers.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class PostgresNotificationFeed implements NotificationFeed {
  private static final Logger logger = Logger.getLogger(PostgresNotificationFeed.class.getName());

  public static final String CHANNEL_PREFIX = "livefeed.";

  private final ConnectionProvider connectionProvider;
  private final Duration pollTimeout;
  private final Duration reconnectDelay;

  private final Object lock = new Object();
  private final Set<String> channels = new LinkedHashSet<>();
  private volatile Connection listenConnection;
  private volatile NotificationSink sink;
  private volatile boolean running;
  private ExecutorService poller;

  private PostgresNotificationFeed(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    if (builder.pollTimeout == null || builder.pollTimeout.isNegative() || builder.pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be > 0");
    }
    if (builder.reconnectDelay == null || builder.reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("reconnectDelay must be >= 0");
    }
    this.pollTimeout = builder.pollTimeout;
    this.reconnectDelay = builder.reconnectDelay;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the quoted store identifier for {@code channel}. */
  static String storeChannel(String channel) {
    if (!Channel.isValidName(channel)) {
      throw new IllegalArgumentException("Invalid channel name: " + channel);
    }
    return '"' + CHANNEL_PREFIX + channel + '"';
  }

  @Override
  public void open(NotificationSink sink) {
    synchronized (lock) {
      if (this.sink != null) {
        throw new IllegalStateException("Feed already open");
      }
      this.sink = Objects.requireNonNull(sink, "sink");
      try {
        listenConnection = connect();
      } catch (SQLException e) {
        this.sink = null;
        throw new NotificationException("Failed to open notification connection", e);
      }
      running = true;
      poller = Executors.newSingleThreadExecutor(new DaemonThreadFactory("livefeed-pg-listen-"));
      poller.execute(this::pollLoop);
    }
  }

  @Override
  public void listen(String channel) {
    String identifier = storeChannel(channel);
    synchronized (lock) {
      checkOpen();
      try {
        execute(listenConnection, "LISTEN " + identifier);
      } catch (SQLException e) {
        throw new NotificationException("Failed to listen on channel " + channel, e);
      }
      channels.add(channel);
    }
  }

  @Override
  public void unlisten(String channel) {
    String identifier = storeChannel(channel);
    synchronized (lock) {
      channels.remove(channel);
      checkOpen();
      try {
        execute(listenConnection, "UNLISTEN " + identifier);
      } catch (SQLException e) {
        throw new NotificationException("Failed to unlisten on channel " + channel, e);
      }
    }
  }

  @Override
  public void notify(String channel, String payload) {
    String name = CHANNEL_PREFIX + channel;
    if (!Channel.isValidName(channel)) {
      throw new IllegalArgumentException("Invalid channel name: " + channel);
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      try (PreparedStatement ps = conn.prepareStatement("SELECT pg_notify(?, ?)")) {
        ps.setString(1, name);
        ps.setString(2, payload);
        ps.execute();
      }
    } catch (SQLException e) {
      throw new NotificationException("Failed to notify on channel " + channel, e);
    }
  }

  @Override
  public void close() {
    ExecutorService toStop;
    synchronized (lock) {
      running = false;
      channels.clear();
      toStop = poller;
      poller = null;
    }
    if (toStop != null) {
      toStop.shutdownNow();
      try {
        toStop.awaitTermination(pollTimeout.toMillis() + 5000, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    closeQuietly(listenConnection);
    listenConnection = null;
  }

  private void pollLoop() {
    while (running) {
      Connection conn = listenConnection;
      try {
        PGNotification[] notifications = conn.unwrap(PGConnection.class)
            .getNotifications((int) pollTimeout.toMillis());
        if (notifications != null) {
          for (PGNotification notification : notifications) {
            deliver(notification);
          }
        }
      } catch (SQLException e) {
        if (!running) {
          return;
        }
        logger.log(Level.SEVERE, "Notification connection failed, reconnecting", e);
        reconnect(conn);
      }
    }
  }

  private void deliver(PGNotification notification) {
    String name = notification.getName();
    if (!name.startsWith(CHANNEL_PREFIX)) {
      return;
    }
    try {
      sink.onNotification(name.substring(CHANNEL_PREFIX.length()), notification.getParameter());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Notification sink failed on channel " + name, e);
    }
  }

  private void reconnect(Connection broken) {
    closeQuietly(broken);
    while (running) {
      try {
        Thread.sleep(reconnectDelay.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      synchronized (lock) {
        if (!running) {
          return;
        }
        Connection replacement = null;
        try {
          replacement = connect();
          for (String channel : channels) {
            execute(replacement, "LISTEN " + storeChannel(channel));
          }
          listenConnection = replacement;
          logger.log(Level.INFO, "Notification connection restored, {0} channel(s) re-listened",
              channels.size());
          return;
        } catch (SQLException e) {
          closeQuietly(replacement);
          logger.log(Level.SEVERE, "Reconnect of notification connection failed", e);
        }
      }
    }
  }

  private Connection connect() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      conn.setAutoCommit(true);
      conn.unwrap(PGConnection.class);
      return conn;
    } catch (SQLException e) {
      closeQuietly(conn);
      throw e;
    }
  }

  private static void execute(Connection conn, String sql) throws SQLException {
    try (Statement statement = conn.createStatement()) {
      statement.execute(sql);
    }
  }

  private void checkOpen() {
    if (!running || listenConnection == null) {
      throw new NotificationException("Feed is not open");
    }
  }

  private static void closeQuietly(Connection conn) {
    if (conn == null) {
      return;
    }
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close notification connection", e);
    }
  }

  /** Builder for {@link PostgresNotificationFeed}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Duration pollTimeout = Duration.ofMillis(250);
    private Duration reconnectDelay = Duration.ofSeconds(1);

    private Builder() {}

    /**
     * Sets where the dedicated listening connection and the short-lived notify connections
     * come from. The listening connection is held for the life of the feed.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets how long one poll waits for notifications.
     *
     * <p>Optional. Defaults to {@code 250ms}. Must be &gt; 0.
     *
     * @param pollTimeout poll timeout
     * @return this builder
     */
    public Builder pollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
      return this;
    }

    /**
     * Sets the pause between reconnect attempts after the listening connection breaks.
     *
     * <p>Optional. Defaults to {@code 1s}. Must be &ge; 0.
     *
     * @param reconnectDelay reconnect delay
     * @return this builder
     */
    public Builder reconnectDelay(Duration reconnectDelay) {
      this.reconnectDelay = reconnectDelay;
      return this;
    }

    /**
     * @throws NullPointerException if {@code connectionProvider} is null
     * @throws IllegalArgumentException if a duration is out of range
     */
    public PostgresNotificationFeed build() {
      return new PostgresNotificationFeed(this);
    }
  }
}
