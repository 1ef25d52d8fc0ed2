package livefeed.spring.boot;

import livefeed.netty.SubscriptionServer;
import org.springframework.context.SmartLifecycle;

/**
 * Binds the {@link SubscriptionServer} once the application context has refreshed, so every
 * {@link SubscriptionEndpoint} is registered before the first connection arrives.
 */
public class SubscriptionServerLifecycle implements SmartLifecycle {

  private final SubscriptionServer server;
  private volatile boolean running;

  public SubscriptionServerLifecycle(SubscriptionServer server) {
    this.server = server;
  }

  @Override
  public void start() {
    try {
      server.start();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while starting subscription server", e);
    }
    running = true;
  }

  @Override
  public void stop() {
    server.close();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
