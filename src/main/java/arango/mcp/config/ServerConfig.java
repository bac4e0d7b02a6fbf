package arango.mcp.config;

import java.util.Locale;
import java.util.function.Function;

/**
 * Process configuration, read once at startup.
 *
 * <p>Values come from system properties first (populated by dotenv from
 * <code>.env.local</code>) and then from the OS environment.</p>
 */
public class ServerConfig {

    /** How tools/list exposes the registry. */
    public enum ToolListingMode {
        FULL,
        BASELINE
    }

    public enum TransportType {
        STDIO,
        HTTP
    }

    public static final int DEFAULT_BASELINE_TOOL_COUNT = 7;

    private final ConnectionConfig connection;
    private final int logLevel;
    private final String logDirectory;
    private final int connectRetries;
    private final long connectDelayMillis;
    private final ToolListingMode toolListingMode;
    private final int baselineToolCount;
    private final TransportType transport;
    private final int httpPort;

    private ServerConfig(Builder builder) {
        this.connection = builder.connection;
        this.logLevel = builder.logLevel;
        this.logDirectory = builder.logDirectory;
        this.connectRetries = builder.connectRetries;
        this.connectDelayMillis = builder.connectDelayMillis;
        this.toolListingMode = builder.toolListingMode;
        this.baselineToolCount = builder.baselineToolCount;
        this.transport = builder.transport;
        this.httpPort = builder.httpPort;
    }

    /**
     * Load from system properties and environment variables.
     */
    public static ServerConfig load() {
        return load(key -> {
            String value = System.getProperty(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getenv(key);
            }
            return value;
        });
    }

    /**
     * Load using an arbitrary key lookup. Missing keys fall back to defaults.
     */
    public static ServerConfig load(Function<String, String> lookup) {
        Builder builder = builder();

        int timeoutSec = parseInt(lookup, "ARANGO_TIMEOUT_SEC", 30);
        builder.connection(new ConnectionConfig(
            get(lookup, "ARANGO_URL", ConnectionConfig.DEFAULT_URL),
            get(lookup, "ARANGO_DB", "_system"),
            get(lookup, "ARANGO_USERNAME", "root"),
            get(lookup, "ARANGO_PASSWORD", ""),
            timeoutSec * 1000));

        builder.logLevel(parseLogLevel(get(lookup, "LOG_LEVEL", "INFO")));
        builder.logDirectory(get(lookup, "MCP_LOG_DIR", "./data/logs"));
        builder.connectRetries(parseInt(lookup, "ARANGO_CONNECT_RETRIES", 3));

        String delay = get(lookup, "ARANGO_CONNECT_DELAY_SEC", "1.0");
        try {
            builder.connectDelayMillis(Math.round(Double.parseDouble(delay) * 1000));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid ARANGO_CONNECT_DELAY_SEC value: '" + delay + "'. Must be a number of seconds.");
        }

        String compat = get(lookup, "MCP_COMPAT_TOOLSET", "full");
        builder.toolListingMode("baseline".equalsIgnoreCase(compat) ? ToolListingMode.BASELINE : ToolListingMode.FULL);
        builder.baselineToolCount(parseInt(lookup, "MCP_COMPAT_TOOLSET_SIZE", DEFAULT_BASELINE_TOOL_COUNT));

        String transport = get(lookup, "MCP_TRANSPORT", "stdio");
        builder.transport("http".equalsIgnoreCase(transport) ? TransportType.HTTP : TransportType.STDIO);
        builder.httpPort(parseInt(lookup, "MCP_HTTP_PORT", 8080));

        return builder.build();
    }

    /**
     * Map a LOG_LEVEL name (or number) onto the 0..4 scale used by the logger.
     */
    public static int parseLogLevel(String value) {
        String level = value.trim().toUpperCase(Locale.ROOT);
        switch (level) {
            case "ERROR":
            case "CRITICAL":
                return 0;
            case "WARN":
            case "WARNING":
            case "INFO":
                return 1;
            case "DETAIL":
                return 2;
            case "DEBUG":
                return 3;
            case "DATA":
            case "TRACE":
                return 4;
            default:
                try {
                    return Math.max(0, Math.min(4, Integer.parseInt(level)));
                } catch (NumberFormatException e) {
                    return 1;
                }
        }
    }

    private static String get(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }

    private static int parseInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = get(lookup, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid " + key + " value: '" + value + "'. Must be a whole number.");
        }
    }

    public ConnectionConfig getConnection() {
        return connection;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public String getLogDirectory() {
        return logDirectory;
    }

    public int getConnectRetries() {
        return connectRetries;
    }

    public long getConnectDelayMillis() {
        return connectDelayMillis;
    }

    public ToolListingMode getToolListingMode() {
        return toolListingMode;
    }

    public int getBaselineToolCount() {
        return baselineToolCount;
    }

    public TransportType getTransport() {
        return transport;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConnectionConfig connection = new ConnectionConfig(ConnectionConfig.DEFAULT_URL, "_system", "root", "", 30_000);
        private int logLevel = 1;
        private String logDirectory = "./data/logs";
        private int connectRetries = 3;
        private long connectDelayMillis = 1000;
        private ToolListingMode toolListingMode = ToolListingMode.FULL;
        private int baselineToolCount = DEFAULT_BASELINE_TOOL_COUNT;
        private TransportType transport = TransportType.STDIO;
        private int httpPort = 8080;

        public Builder connection(ConnectionConfig connection) {
            this.connection = connection;
            return this;
        }

        public Builder logLevel(int logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder logDirectory(String logDirectory) {
            this.logDirectory = logDirectory;
            return this;
        }

        public Builder connectRetries(int connectRetries) {
            this.connectRetries = connectRetries;
            return this;
        }

        public Builder connectDelayMillis(long connectDelayMillis) {
            this.connectDelayMillis = connectDelayMillis;
            return this;
        }

        public Builder toolListingMode(ToolListingMode toolListingMode) {
            this.toolListingMode = toolListingMode;
            return this;
        }

        public Builder baselineToolCount(int baselineToolCount) {
            this.baselineToolCount = baselineToolCount;
            return this;
        }

        public Builder transport(TransportType transport) {
            this.transport = transport;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
