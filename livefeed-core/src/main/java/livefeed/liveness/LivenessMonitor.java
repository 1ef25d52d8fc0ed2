package livefeed.liveness;

import livefeed.session.SessionGroup;
import livefeed.session.SubscriptionSession;
import livefeed.spi.MetricsExporter;
import livefeed.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically probes every open session and terminates connections that stopped answering.
 *
 * <p>Each tick, a session whose previous ping was answered is marked unconfirmed and pinged
 * again; a session still unconfirmed from the previous tick is terminated. A connection is
 * therefore terminated at the first tick that finds the previous ping unanswered.
 *
 * <p>Same lifecycle as the other schedulers: builder, {@link #start()}, {@link #runOnce()} for
 * direct invocation, {@link AutoCloseable}, a single daemon thread.
 */
public final class LivenessMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LivenessMonitor.class.getName());

  private final SessionGroup sessions;
  private final Duration interval;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> probeTask;
  private volatile boolean closed;

  private LivenessMonitor(Builder builder) {
    this.sessions = Objects.requireNonNull(builder.sessions, "sessions");
    if (builder.interval == null || builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.interval = builder.interval;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration interval() {
    return interval;
  }

  /**
   * Starts the probe loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("LivenessMonitor has been closed");
    }
    if (probeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("livefeed-liveness-"));
    long millis = interval.toMillis();
    probeTask = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Probes every session once.
   *
   * @return the number of connections terminated
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    int terminated = 0;
    for (SubscriptionSession session : sessions.snapshot()) {
      try {
        if (!session.probe()) {
          terminated++;
          metrics.incrementConnectionsTerminated();
        }
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Liveness probe failed for account " + session.accountId(), t);
      }
    }
    return terminated;
  }

  /** Cancels the probe schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (probeTask != null) {
      probeTask.cancel(false);
      probeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link LivenessMonitor}. */
  public static final class Builder {
    private SessionGroup sessions;
    private Duration interval = Duration.ofSeconds(30);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the sessions to probe.
     *
     * <p><b>Required.</b>
     *
     * @param sessions the session group
     * @return this builder
     */
    public Builder sessions(SessionGroup sessions) {
      this.sessions = sessions;
      return this;
    }

    /**
     * Sets the time between probes.
     *
     * <p>Optional. Defaults to {@code 30s}. Must be &gt; 0.
     *
     * @param interval probe interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the monitor. Call {@link LivenessMonitor#start()} to begin.
     *
     * @throws NullPointerException if {@code sessions} is null
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public LivenessMonitor build() {
      return new LivenessMonitor(this);
    }
  }
}
