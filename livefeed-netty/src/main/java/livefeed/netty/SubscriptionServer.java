package livefeed.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import livefeed.context.Contexts;
import livefeed.liveness.LivenessMonitor;
import livefeed.session.SessionGroup;
import livefeed.session.SessionOptions;
import livefeed.session.SubscriptionRouter;
import livefeed.session.SubscriptionSession;
import livefeed.session.WireCodec;
import livefeed.spi.MetricsExporter;
import livefeed.util.DaemonThreadFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket server speaking the subscription protocol.
 *
 * <p>Each connection runs through an HTTP codec and aggregator, then
 * {@link HandshakeAuthenticator}, the WebSocket protocol handler (pongs passed through) and
 * finally {@link SubscriptionFrameHandler}, which owns the connection's session. Text frames
 * that are not valid UTF-8 get a {@code BAD_INPUT} error and the connection stays open.
 *
 * <p>When a liveness interval is set the server owns a {@link LivenessMonitor} over its
 * sessions and starts and stops it with itself.
 *
 * <pre>{@code
 * try (SubscriptionServer server = SubscriptionServer.builder()
 *     .port(4000)
 *     .router(router)
 *     .contexts(contexts)
 *     .handlerExecutor(handlerPool)
 *     .authenticator(tokens::verify)
 *     .build()) {
 *   server.start();
 *   ...
 * }
 * }</pre>
 */
public final class SubscriptionServer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SubscriptionServer.class.getName());

  private final String host;
  private final int port;
  private final String path;
  private final int maxFrameBytes;
  private final SubscriptionRouter router;
  private final Contexts contexts;
  private final Executor handlerExecutor;
  private final Authenticator authenticator;
  private final WireCodec codec;
  private final SessionOptions options;
  private final MetricsExporter metrics;
  private final SessionGroup sessions;
  private final LivenessMonitor livenessMonitor;
  private final int workerThreads;

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private Channel serverChannel;
  private boolean closed;

  private SubscriptionServer(Builder builder) {
    this.router = Objects.requireNonNull(builder.router, "router");
    this.contexts = Objects.requireNonNull(builder.contexts, "contexts");
    this.handlerExecutor = Objects.requireNonNull(builder.handlerExecutor, "handlerExecutor");
    this.authenticator = Objects.requireNonNull(builder.authenticator, "authenticator");
    if (builder.port < 0 || builder.port > 65535) {
      throw new IllegalArgumentException("port must be in [0, 65535]");
    }
    if (builder.path == null || !builder.path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/'");
    }
    if (builder.maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be > 0");
    }
    if (builder.workerThreads < 0) {
      throw new IllegalArgumentException("workerThreads must be >= 0");
    }
    this.host = builder.host;
    this.port = builder.port;
    this.path = builder.path;
    this.maxFrameBytes = builder.maxFrameBytes;
    this.workerThreads = builder.workerThreads;
    this.codec = builder.codec != null ? builder.codec : new WireCodec();
    this.options = builder.options != null ? builder.options : SessionOptions.DEFAULTS;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sessions = builder.sessions != null ? builder.sessions : new SessionGroup(metrics);
    this.livenessMonitor = builder.livenessInterval == null ? null : LivenessMonitor.builder()
        .sessions(sessions)
        .interval(builder.livenessInterval)
        .metrics(metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Binds the listening socket and starts the liveness monitor, if any.
   *
   * @throws IllegalStateException if the server was already started or closed
   * @throws InterruptedException if interrupted while binding
   */
  public synchronized void start() throws InterruptedException {
    if (closed) {
      throw new IllegalStateException("SubscriptionServer has been closed");
    }
    if (serverChannel != null) {
      throw new IllegalStateException("SubscriptionServer already started");
    }
    bossGroup = new NioEventLoopGroup(1, new DaemonThreadFactory("livefeed-ws-boss-"));
    workerGroup = new NioEventLoopGroup(workerThreads, new DaemonThreadFactory("livefeed-ws-io-"));
    WebSocketServerProtocolConfig protocolConfig = WebSocketServerProtocolConfig.newBuilder()
        .websocketPath(path)
        .checkStartsWith(true)
        .dropPongFrames(false)
        .maxFramePayloadLength(maxFrameBytes)
        .withUTF8Validator(false)
        .build();
    SessionFactory sessionFactory = (accountId, transport) -> SubscriptionSession.builder()
        .accountId(accountId)
        .transport(transport)
        .router(router)
        .contexts(contexts)
        .handlerExecutor(handlerExecutor)
        .codec(codec)
        .options(options)
        .metrics(metrics)
        .build();

    ServerBootstrap bootstrap = new ServerBootstrap()
        .group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childOption(ChannelOption.SO_KEEPALIVE, true)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ChannelPipeline p = ch.pipeline();
            p.addLast(new HttpServerCodec());
            p.addLast(new HttpObjectAggregator(65536));
            p.addLast(new HandshakeAuthenticator(path, authenticator));
            p.addLast(new WebSocketServerProtocolHandler(protocolConfig));
            p.addLast(new WebSocketFrameAggregator(maxFrameBytes));
            p.addLast(new SubscriptionFrameHandler(sessionFactory, sessions));
          }
        });
    InetSocketAddress address = host == null ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    try {
      serverChannel = bootstrap.bind(address).sync().channel();
    } catch (Throwable t) {
      shutdownGroups();
      throw t;
    }
    if (livenessMonitor != null) {
      livenessMonitor.start();
    }
    logger.log(Level.INFO, "Subscription server listening on {0}{1}",
        new Object[]{serverChannel.localAddress(), path});
  }

  /** Returns the bound port, useful when configured with port 0. */
  public synchronized int port() {
    if (serverChannel == null) {
      throw new IllegalStateException("SubscriptionServer is not started");
    }
    return ((InetSocketAddress) serverChannel.localAddress()).getPort();
  }

  public SessionGroup sessions() {
    return sessions;
  }

  /**
   * Stops accepting connections, closes every open connection and releases the event loops.
   * Sessions tear down their subscriptions as their channels go inactive.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (livenessMonitor != null) {
      livenessMonitor.close();
    }
    if (serverChannel != null) {
      serverChannel.close().awaitUninterruptibly();
      logger.log(Level.INFO, "Subscription server on {0} stopped", serverChannel.localAddress());
    }
    shutdownGroups();
  }

  private void shutdownGroups() {
    if (workerGroup != null) {
      workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).awaitUninterruptibly();
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).awaitUninterruptibly();
    }
  }

  /** Builder for {@link SubscriptionServer}. */
  public static final class Builder {
    private String host;
    private int port = 4000;
    private String path = "/";
    private int maxFrameBytes = 65536;
    private int workerThreads;
    private SubscriptionRouter router;
    private Contexts contexts;
    private Executor handlerExecutor;
    private Authenticator authenticator;
    private WireCodec codec;
    private SessionOptions options;
    private MetricsExporter metrics;
    private SessionGroup sessions;
    private Duration livenessInterval = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * Optional. Defaults to all interfaces.
     *
     * @param host bind address
     * @return this builder
     */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    /**
     * Optional. Defaults to {@code 4000}; {@code 0} picks a free port.
     *
     * @param port listen port
     * @return this builder
     */
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    /**
     * Sets the HTTP path that accepts WebSocket upgrades.
     *
     * <p>Optional. Defaults to {@code /}.
     *
     * @param path upgrade path
     * @return this builder
     */
    public Builder path(String path) {
      this.path = path;
      return this;
    }

    /**
     * Optional. Defaults to {@code 65536}.
     *
     * @param maxFrameBytes largest accepted frame payload, in bytes
     * @return this builder
     */
    public Builder maxFrameBytes(int maxFrameBytes) {
      this.maxFrameBytes = maxFrameBytes;
      return this;
    }

    /**
     * Optional. Defaults to {@code 0}, which lets Netty size the I/O pool.
     *
     * @param workerThreads number of I/O threads
     * @return this builder
     */
    public Builder workerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param router subscription paths
     * @return this builder
     */
    public Builder router(SubscriptionRouter router) {
      this.router = router;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param contexts transaction contexts handed to subscription handlers
     * @return this builder
     */
    public Builder contexts(Contexts contexts) {
      this.contexts = contexts;
      return this;
    }

    /**
     * Sets where subscription handlers and unsubscribes run. Never the I/O threads.
     *
     * <p><b>Required.</b>
     *
     * @param handlerExecutor handler executor
     * @return this builder
     */
    public Builder handlerExecutor(Executor handlerExecutor) {
      this.handlerExecutor = handlerExecutor;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param authenticator resolves access tokens to accounts
     * @return this builder
     */
    public Builder authenticator(Authenticator authenticator) {
      this.authenticator = authenticator;
      return this;
    }

    /**
     * Optional. Defaults to a codec over a plain {@code ObjectMapper}.
     *
     * @param codec wire codec
     * @return this builder
     */
    public Builder codec(WireCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Optional. Defaults to {@link SessionOptions#DEFAULTS}.
     *
     * @param options session options
     * @return this builder
     */
    public Builder options(SessionOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to a new group reporting to the configured metrics.
     *
     * @param sessions group the server's sessions join
     * @return this builder
     */
    public Builder sessions(SessionGroup sessions) {
      this.sessions = sessions;
      return this;
    }

    /**
     * Sets the liveness probe interval, or {@code null} to run without a liveness monitor.
     *
     * <p>Optional. Defaults to {@code 30s}.
     *
     * @param livenessInterval probe interval
     * @return this builder
     */
    public Builder livenessInterval(Duration livenessInterval) {
      this.livenessInterval = livenessInterval;
      return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if a setting is out of range
     */
    public SubscriptionServer build() {
      return new SubscriptionServer(this);
    }
  }
}
