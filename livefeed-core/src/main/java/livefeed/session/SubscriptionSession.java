package livefeed.session;

import com.fasterxml.jackson.databind.JsonNode;
import livefeed.AccountId;
import livefeed.ApiErrorCode;
import livefeed.ApiException;
import livefeed.context.AuthorizedContext;
import livefeed.context.ContextAction;
import livefeed.context.Contexts;
import livefeed.context.SubscriptionContext;
import livefeed.spi.MetricsExporter;
import livefeed.spi.SessionTransport;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server side of one client connection: decodes frames, owns the connection's subscriptions
 * and tears them all down when the connection closes.
 *
 * <h2>Subscribe</h2>
 * <p>The id check, path lookup, input validation and placeholder insert all happen under the
 * session lock before any asynchronous work, so two {@code subscribe} frames with the same id
 * resolve deterministically: the first wins and the second gets {@code ALREADY_EXISTS}. The
 * handler then runs on the handler executor and its {@link Unsubscribe} completes the
 * placeholder. A handler failure completes the placeholder with a no-op and reports the error;
 * the id stays taken until the client unsubscribes it.
 *
 * <h2>Unsubscribe and close</h2>
 * <p>Removing an entry deactivates its {@link SubscriptionContext} first, so nothing is
 * published for it afterwards, then awaits the placeholder and runs the unsubscribe. On
 * {@link #close()} every entry is torn down that way, including registrations still in flight.
 * Teardown failures are logged and never propagate.
 *
 * <p>Create instances via {@link #builder()}; one per connection.
 */
public final class SubscriptionSession {
  private static final Logger logger = Logger.getLogger(SubscriptionSession.class.getName());

  private final AccountId accountId;
  private final SessionTransport transport;
  private final SubscriptionRouter router;
  private final Contexts contexts;
  private final Executor handlerExecutor;
  private final WireCodec codec;
  private final SessionOptions options;
  private final MetricsExporter metrics;

  private final Object lock = new Object();
  private final Map<String, Subscription> subscriptions = new HashMap<>();
  private final AtomicBoolean alive = new AtomicBoolean(true);
  private boolean closed;
  private CompletableFuture<Void> closeFuture;

  private SubscriptionSession(Builder builder) {
    this.accountId = Objects.requireNonNull(builder.accountId, "accountId");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.router = Objects.requireNonNull(builder.router, "router");
    this.contexts = Objects.requireNonNull(builder.contexts, "contexts");
    this.handlerExecutor = Objects.requireNonNull(builder.handlerExecutor, "handlerExecutor");
    this.codec = builder.codec != null ? builder.codec : new WireCodec();
    this.options = builder.options != null ? builder.options : SessionOptions.DEFAULTS;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    metrics.incrementSessionsOpened();
  }

  public static Builder builder() {
    return new Builder();
  }

  public AccountId accountId() {
    return accountId;
  }

  /**
   * Handles one text frame.
   *
   * @return completes once a subscribe has been acknowledged or rejected, or an unsubscribe
   *     has run; never completes exceptionally
   */
  public CompletableFuture<Void> onText(String text) {
    ClientMessage message;
    try {
      message = codec.decode(text);
    } catch (ApiException e) {
      sendError(null, e);
      return CompletableFuture.completedFuture(null);
    }
    if (message instanceof ClientMessage.Subscribe subscribe) {
      return subscribe(subscribe);
    }
    return unsubscribe((ClientMessage.Unsubscribe) message);
  }

  /** Binary frames are not part of the protocol; the connection stays open. */
  public void onBinary() {
    sendError(null, new ApiException(ApiErrorCode.BAD_INPUT, "Binary frames are not supported"));
  }

  /** Text frames whose payload is not valid UTF-8; the connection stays open. */
  public void onUndecodableText() {
    sendError(null, new ApiException(ApiErrorCode.BAD_INPUT, "Text frame is not valid UTF-8"));
  }

  /** Marks the connection as having answered the last ping. */
  public void confirmAlive() {
    alive.set(true);
  }

  /**
   * Runs one liveness probe: terminates the connection if the previous ping went unanswered,
   * otherwise marks it unconfirmed and pings again.
   *
   * @return {@code false} if the connection was terminated
   */
  public boolean probe() {
    if (!alive.getAndSet(false)) {
      logger.log(Level.INFO, "Terminating unresponsive connection for account {0}", accountId);
      transport.terminate();
      return false;
    }
    transport.ping();
    return true;
  }

  /** Returns the number of subscription ids currently held, including in-flight ones. */
  public int subscriptionCount() {
    synchronized (lock) {
      return subscriptions.size();
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /**
   * Tears down every subscription. Idempotent; later calls return the same future.
   *
   * @return completes once every unsubscribe has run; never completes exceptionally
   */
  public CompletableFuture<Void> close() {
    List<Map.Entry<String, Subscription>> remaining;
    synchronized (lock) {
      if (closed) {
        return closeFuture;
      }
      closed = true;
      remaining = new ArrayList<>(subscriptions.entrySet());
      subscriptions.clear();
      List<CompletableFuture<Void>> teardowns = new ArrayList<>(remaining.size());
      for (Map.Entry<String, Subscription> entry : remaining) {
        entry.getValue().context.deactivate();
      }
      for (Map.Entry<String, Subscription> entry : remaining) {
        teardowns.add(teardown(entry.getKey(), entry.getValue()));
      }
      closeFuture = CompletableFuture.allOf(teardowns.toArray(new CompletableFuture<?>[0]));
    }
    metrics.incrementSessionsClosed();
    return closeFuture;
  }

  private CompletableFuture<Void> subscribe(ClientMessage.Subscribe message) {
    String id = message.id();
    CompletableFuture<Unsubscribe> placeholder = new CompletableFuture<>();
    SessionSubscriptionContext context = new SessionSubscriptionContext(id);
    HandlerCall call;
    synchronized (lock) {
      if (closed) {
        return CompletableFuture.completedFuture(null);
      }
      try {
        if (subscriptions.containsKey(id)) {
          throw new ApiException(ApiErrorCode.ALREADY_EXISTS, "Subscription id already in use: " + id);
        }
        SubscriptionRoute<?> route = router.route(message.path())
            .orElseThrow(() -> new ApiException(ApiErrorCode.NOT_FOUND, "Unknown path: " + message.path()));
        call = prepare(route, message.input());
      } catch (ApiException e) {
        call = null;
        reject(id, e);
      }
      if (call != null) {
        subscriptions.put(id, new Subscription(context, placeholder));
      }
    }
    if (call == null) {
      return CompletableFuture.completedFuture(null);
    }

    CompletableFuture<Void> done = new CompletableFuture<>();
    HandlerCall handlerCall = call;
    try {
      handlerExecutor.execute(() -> runHandler(id, handlerCall, context, placeholder, done));
    } catch (RejectedExecutionException e) {
      placeholder.complete(Unsubscribe.NOOP);
      metrics.incrementSubscriptionsFailed();
      sendError(id, e);
      done.complete(null);
    }
    return done;
  }

  private void reject(String id, ApiException e) {
    metrics.incrementSubscriptionsFailed();
    sendError(id, e);
  }

  private static <I> HandlerCall prepare(SubscriptionRoute<I> route, JsonNode rawInput) {
    I input;
    try {
      input = route.reader().read(rawInput);
    } catch (ApiException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ApiException(ApiErrorCode.BAD_INPUT, "Invalid input for " + route.path(), e);
    }
    return ctx -> route.handler().subscribe(ctx, input);
  }

  private void runHandler(String id, HandlerCall call, SessionSubscriptionContext context,
      CompletableFuture<Unsubscribe> placeholder, CompletableFuture<Void> done) {
    try {
      Unsubscribe unsubscribe;
      try {
        unsubscribe = call.subscribe(context);
      } catch (Throwable t) {
        placeholder.complete(Unsubscribe.NOOP);
        metrics.incrementSubscriptionsFailed();
        if (context.isActive()) {
          sendError(id, t);
        }
        return;
      }
      placeholder.complete(unsubscribe != null ? unsubscribe : Unsubscribe.NOOP);
      metrics.incrementSubscriptionsStarted();
      if (context.isActive()) {
        send(codec.subscribed(id));
      }
    } finally {
      done.complete(null);
    }
  }

  private CompletableFuture<Void> unsubscribe(ClientMessage.Unsubscribe message) {
    String id = message.id();
    Subscription subscription;
    synchronized (lock) {
      if (closed) {
        return CompletableFuture.completedFuture(null);
      }
      subscription = subscriptions.remove(id);
    }
    if (subscription == null) {
      sendError(id, new ApiException(ApiErrorCode.NOT_FOUND, "No subscription with id " + id));
      return CompletableFuture.completedFuture(null);
    }
    subscription.context.deactivate();
    return teardown(id, subscription);
  }

  private CompletableFuture<Void> teardown(String id, Subscription subscription) {
    return subscription.unsubscribe.thenCompose(unsubscribe -> {
      try {
        return CompletableFuture.runAsync(() -> runUnsubscribe(id, unsubscribe), handlerExecutor);
      } catch (RejectedExecutionException e) {
        // executor already shut down: run on the completing thread
        logger.log(Level.FINE, "Handler executor rejected unsubscribe for {0}, running inline", id);
        runUnsubscribe(id, unsubscribe);
        return CompletableFuture.<Void>completedFuture(null);
      }
    });
  }

  private void runUnsubscribe(String id, Unsubscribe unsubscribe) {
    try {
      unsubscribe.unsubscribe();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Unsubscribe failed for subscription " + id, e);
    } finally {
      metrics.incrementSubscriptionsEnded();
    }
  }

  private void sendError(String id, Throwable error) {
    ApiErrorCode code;
    if (error instanceof ApiException api) {
      code = api.code();
    } else {
      logger.log(Level.SEVERE, "Unexpected error in subscription " + id + " for account " + accountId, error);
      code = ApiErrorCode.UNKNOWN;
    }
    metrics.incrementErrorsSent();
    send(codec.error(id, code, options.exposeServerStack() ? stackTrace(error) : null));
  }

  private void send(String frame) {
    try {
      transport.send(frame);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to send frame to account " + accountId, e);
    }
  }

  private static String stackTrace(Throwable error) {
    StringWriter out = new StringWriter();
    error.printStackTrace(new PrintWriter(out));
    return out.toString();
  }

  @FunctionalInterface
  private interface HandlerCall {
    Unsubscribe subscribe(SubscriptionContext<Object> ctx) throws Exception;
  }

  private static final class Subscription {
    private final SessionSubscriptionContext context;
    private final CompletableFuture<Unsubscribe> unsubscribe;

    private Subscription(SessionSubscriptionContext context, CompletableFuture<Unsubscribe> unsubscribe) {
      this.context = context;
      this.unsubscribe = unsubscribe;
    }
  }

  private final class SessionSubscriptionContext implements SubscriptionContext<Object> {
    private final String id;
    private boolean active = true;

    private SessionSubscriptionContext(String id) {
      this.id = id;
    }

    @Override
    public AccountId accountId() {
      return accountId;
    }

    @Override
    public synchronized void publish(Object message) {
      if (!active) {
        logger.log(Level.FINE, "Dropping message for inactive subscription {0}", id);
        return;
      }
      String frame;
      try {
        frame = codec.message(id, message);
      } catch (IllegalArgumentException e) {
        logger.log(Level.SEVERE, "Failed to encode message for subscription " + id, e);
        return;
      }
      metrics.incrementMessagesPublished();
      send(frame);
    }

    @Override
    public <T, E extends Exception> T withAuthorized(ContextAction<AuthorizedContext, T, E> action) throws E {
      return contexts.withAuthorized(accountId, action);
    }

    @Override
    public synchronized boolean isActive() {
      return active;
    }

    private synchronized void deactivate() {
      active = false;
    }
  }

  /** Builder for {@link SubscriptionSession}. */
  public static final class Builder {
    private AccountId accountId;
    private SessionTransport transport;
    private SubscriptionRouter router;
    private Contexts contexts;
    private Executor handlerExecutor;
    private WireCodec codec;
    private SessionOptions options;
    private MetricsExporter metrics;

    private Builder() {}

    /** <b>Required.</b> The authenticated account of this connection. */
    public Builder accountId(AccountId accountId) {
      this.accountId = accountId;
      return this;
    }

    /** <b>Required.</b> */
    public Builder transport(SessionTransport transport) {
      this.transport = transport;
      return this;
    }

    /** <b>Required.</b> */
    public Builder router(SubscriptionRouter router) {
      this.router = router;
      return this;
    }

    /** <b>Required.</b> Used by handlers to step up into authorized transactions. */
    public Builder contexts(Contexts contexts) {
      this.contexts = contexts;
      return this;
    }

    /** <b>Required.</b> Runs handlers and unsubscribes; may block on the store. */
    public Builder handlerExecutor(Executor handlerExecutor) {
      this.handlerExecutor = handlerExecutor;
      return this;
    }

    /** Optional. Defaults to a codec with a plain {@code ObjectMapper}. */
    public Builder codec(WireCodec codec) {
      this.codec = codec;
      return this;
    }

    /** Optional. Defaults to {@link SessionOptions#DEFAULTS}. */
    public Builder options(SessionOptions options) {
      this.options = options;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SubscriptionSession build() {
      return new SubscriptionSession(this);
    }
  }
}
