package de.bsommerfeld.socialnetwork.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Listening address and store location of the service.
 *
 * <p>
 * Every value is read from a system property first, then from an
 * environment variable, and otherwise falls back to the defaults the API has
 * always used ({@code 127.0.0.1:8001}, {@code social_network.db} in the
 * working directory).
 *
 * <table>
 * <tr><th>Property</th><th>Environment</th><th>Default</th></tr>
 * <tr><td>{@code socialnet.host}</td><td>{@code SOCIALNET_HOST}</td><td>{@code 127.0.0.1}</td></tr>
 * <tr><td>{@code socialnet.port}</td><td>{@code SOCIALNET_PORT}</td><td>{@code 8001}</td></tr>
 * <tr><td>{@code socialnet.db}</td><td>{@code SOCIALNET_DB}</td><td>{@code social_network.db}</td></tr>
 * </table>
 */
public final class ServerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8001;
    public static final String DEFAULT_DATABASE_FILE = "social_network.db";

    private final String host;
    private final int port;
    private final Path databaseFile;

    public ServerConfig(String host, int port, Path databaseFile) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        this.host = host;
        this.port = port;
        this.databaseFile = databaseFile;
    }

    /** The defaults, ignoring properties and environment. */
    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HOST, DEFAULT_PORT, Paths.get(DEFAULT_DATABASE_FILE));
    }

    /**
     * Resolves the configuration from system properties and environment
     * variables. A port that is not a valid number logs a warning and the
     * default is used instead.
     */
    public static ServerConfig load() {
        String host = lookup("socialnet.host", "SOCIALNET_HOST");
        String port = lookup("socialnet.port", "SOCIALNET_PORT");
        String db = lookup("socialnet.db", "SOCIALNET_DB");

        return new ServerConfig(
                host != null ? host.trim() : DEFAULT_HOST,
                parsePort(port),
                Paths.get(db != null ? db.trim() : DEFAULT_DATABASE_FILE));
    }

    static int parsePort(String value) {
        if (value == null) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(value.trim());
            if (port >= 0 && port <= 65535) {
                return port;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        LOG.warn("Invalid port '{}'. Defaulting to {}.", value, DEFAULT_PORT);
        return DEFAULT_PORT;
    }

    /**
     * Returns the system property {@code property}, or the environment
     * variable {@code env} when the property is unset. Blank values count as
     * unset.
     */
    static String lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return (value == null || value.isBlank()) ? null : value;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port + ", databaseFile=" + databaseFile + "}";
    }
}
