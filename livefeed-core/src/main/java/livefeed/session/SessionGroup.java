package livefeed.session;

import livefeed.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The open sessions of one server. The transport adds a session when its connection opens and
 * removes it when the connection closes; the liveness monitor probes the current members.
 */
public final class SessionGroup {
  private final Set<SubscriptionSession> sessions = ConcurrentHashMap.newKeySet();
  private final MetricsExporter metrics;

  public SessionGroup() {
    this(MetricsExporter.NOOP);
  }

  public SessionGroup(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public void add(SubscriptionSession session) {
    sessions.add(Objects.requireNonNull(session, "session"));
    metrics.recordActiveSessions(sessions.size());
  }

  public void remove(SubscriptionSession session) {
    sessions.remove(session);
    metrics.recordActiveSessions(sessions.size());
  }

  public List<SubscriptionSession> snapshot() {
    return List.copyOf(sessions);
  }

  public int size() {
    return sessions.size();
  }
}
