package livefeed.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.context.Contexts;
import livefeed.jdbc.DataSourceConnectionProvider;
import livefeed.jdbc.dialect.Dialects;
import livefeed.jdbc.notify.PostgresNotificationFeed;
import livefeed.jdbc.spi.Dialect;
import livefeed.jdbc.tx.JdbcContexts;
import livefeed.netty.Authenticator;
import livefeed.netty.SubscriptionServer;
import livefeed.registry.ChannelRegistry;
import livefeed.registry.InMemoryNotificationFeed;
import livefeed.session.SessionGroup;
import livefeed.session.SessionOptions;
import livefeed.session.SubscriptionRouter;
import livefeed.session.WireCodec;
import livefeed.spi.ConnectionProvider;
import livefeed.spi.MetricsExporter;
import livefeed.spi.NotificationFeed;
import livefeed.util.DaemonThreadFactory;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Auto-configuration for livefeed.
 *
 * <p>Wires transaction contexts, the notification feed and channel registry, the subscription
 * router and, when the application provides an {@link Authenticator}, the WebSocket
 * subscription server.
 *
 * @see LivefeedProperties
 * @see LivefeedMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass(ChannelRegistry.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(LivefeedProperties.class)
public class LivefeedAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Dialect livefeedDialect(DataSource dataSource) {
    return Dialects.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(Contexts.class)
  public JdbcContexts contexts(ConnectionProvider connectionProvider, Dialect dialect) {
    return new JdbcContexts(connectionProvider, dialect);
  }

  /** Closed by the channel registry that owns it. */
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public NotificationFeed notificationFeed(LivefeedProperties props, ConnectionProvider connectionProvider,
      Dialect dialect) {
    LivefeedProperties.Feed feed = props.getFeed();
    boolean postgres = switch (feed.getType()) {
      case POSTGRES -> true;
      case IN_MEMORY -> false;
      case AUTO -> "postgresql".equals(dialect.name());
    };
    if (!postgres) {
      return new InMemoryNotificationFeed();
    }
    return PostgresNotificationFeed.builder()
        .connectionProvider(connectionProvider)
        .pollTimeout(feed.getPollTimeout())
        .reconnectDelay(feed.getReconnectDelay())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ChannelRegistry channelRegistry(LivefeedProperties props, NotificationFeed notificationFeed,
      ObjectProvider<ObjectMapper> objectMapper, ObjectProvider<MetricsExporter> metrics) {
    return ChannelRegistry.builder()
        .feed(notificationFeed)
        .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
        .dispatchThreads(props.getDispatch().getThreads())
        .metrics(metrics.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public WireCodec wireCodec(ObjectProvider<ObjectMapper> objectMapper) {
    return new WireCodec(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean
  public SubscriptionRouter subscriptionRouter() {
    return new SubscriptionRouter();
  }

  @Bean
  @ConditionalOnMissingBean
  public SubscriptionEndpointRegistrar subscriptionEndpointRegistrar(ListableBeanFactory beanFactory,
      SubscriptionRouter router, WireCodec codec) {
    return new SubscriptionEndpointRegistrar(beanFactory, router, codec.objectMapper());
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionGroup sessionGroup(ObjectProvider<MetricsExporter> metrics) {
    return new SessionGroup(metrics.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(name = "livefeedHandlerExecutor")
  public ExecutorService livefeedHandlerExecutor(LivefeedProperties props) {
    int threads = props.getHandler().getThreads();
    if (threads <= 0) {
      throw new IllegalStateException("livefeed.handler.threads must be > 0");
    }
    return Executors.newFixedThreadPool(threads, new DaemonThreadFactory("livefeed-handler-"));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(Authenticator.class)
  @ConditionalOnProperty(prefix = "livefeed.server", name = "enabled", matchIfMissing = true)
  public SubscriptionServer subscriptionServer(LivefeedProperties props,
      Authenticator authenticator,
      SubscriptionRouter router,
      Contexts contexts,
      WireCodec codec,
      SessionGroup sessionGroup,
      @Qualifier("livefeedHandlerExecutor") ExecutorService handlerExecutor,
      ObjectProvider<MetricsExporter> metrics) {
    LivefeedProperties.Server server = props.getServer();
    Duration interval = props.getLiveness().getInterval();
    return SubscriptionServer.builder()
        .host(server.getHost())
        .port(server.getPort())
        .path(server.getPath())
        .maxFrameBytes(server.getMaxFrameBytes())
        .authenticator(authenticator)
        .router(router)
        .contexts(contexts)
        .codec(codec)
        .sessions(sessionGroup)
        .handlerExecutor(handlerExecutor)
        .options(new SessionOptions(props.isExposeServerStack()))
        .metrics(metrics.getIfAvailable(() -> MetricsExporter.NOOP))
        .livenessInterval(interval == null || interval.isZero() ? null : interval)
        .build();
  }

  @Bean
  @ConditionalOnBean(SubscriptionServer.class)
  public SubscriptionServerLifecycle subscriptionServerLifecycle(SubscriptionServer subscriptionServer) {
    return new SubscriptionServerLifecycle(subscriptionServer);
  }
}
