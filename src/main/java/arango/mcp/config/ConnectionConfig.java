package arango.mcp.config;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * ArangoDB connection settings resolved from ARANGO_* configuration.
 */
public class ConnectionConfig {

    public static final String DEFAULT_URL = "http://localhost:8529";
    private static final int DEFAULT_PORT = 8529;

    private final String url;
    private final String host;
    private final int port;
    private final boolean useSsl;
    private final String database;
    private final String username;
    private final String password;
    private final int timeoutMillis;

    public ConnectionConfig(String url, String database, String username, String password, int timeoutMillis) {
        this.url = url;
        this.database = database;
        this.username = username;
        this.password = password;
        this.timeoutMillis = timeoutMillis;

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid ARANGO_URL value: '" + url + "'", e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException(
                "Invalid ARANGO_URL value: '" + url + "'. Expected something like " + DEFAULT_URL);
        }
        this.host = uri.getHost();
        this.useSsl = "https".equalsIgnoreCase(uri.getScheme());
        this.port = uri.getPort() > 0 ? uri.getPort() : (useSsl ? 443 : DEFAULT_PORT);
    }

    public String getUrl() {
        return url;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isUseSsl() {
        return useSsl;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public String toString() {
        // Password stays out of logs
        return "ConnectionConfig{url='" + url + "', database='" + database + "', user='" + username
            + "', timeoutMillis=" + timeoutMillis + "}";
    }
}
