package livefeed.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for livefeed.
 *
 * @see LivefeedAutoConfiguration
 */
@ConfigurationProperties(prefix = "livefeed")
public class LivefeedProperties {

    /**
     * Send server stack traces with {@code UNKNOWN} errors. Development only.
     */
    private boolean exposeServerStack = false;

    private final Server server = new Server();
    private final Liveness liveness = new Liveness();
    private final Handler handler = new Handler();
    private final Dispatch dispatch = new Dispatch();
    private final Feed feed = new Feed();
    private final Metrics metrics = new Metrics();

    public boolean isExposeServerStack() {
        return exposeServerStack;
    }

    public void setExposeServerStack(boolean exposeServerStack) {
        this.exposeServerStack = exposeServerStack;
    }

    public Server getServer() {
        return server;
    }

    public Liveness getLiveness() {
        return liveness;
    }

    public Handler getHandler() {
        return handler;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Feed getFeed() {
        return feed;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum FeedType {
        /** PostgreSQL {@code LISTEN}/{@code NOTIFY} on PostgreSQL, in-memory otherwise. */
        AUTO,
        POSTGRES,
        IN_MEMORY
    }

    public static class Server {
        private boolean enabled = true;
        private String host;
        private int port = 4000;
        private String path = "/";
        private int maxFrameBytes = 65536;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }
    }

    public static class Liveness {
        /**
         * Ping interval. Zero disables the liveness monitor.
         */
        private Duration interval = Duration.ofSeconds(30);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Handler {
        /**
         * Threads running subscription handlers and unsubscribes.
         */
        private int threads = 8;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Dispatch {
        /**
         * Threads delivering notifications to listeners.
         */
        private int threads = 4;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Feed {
        private FeedType type = FeedType.AUTO;
        private Duration pollTimeout = Duration.ofMillis(250);
        private Duration reconnectDelay = Duration.ofSeconds(1);

        public FeedType getType() {
            return type;
        }

        public void setType(FeedType type) {
            this.type = type;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "livefeed";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
