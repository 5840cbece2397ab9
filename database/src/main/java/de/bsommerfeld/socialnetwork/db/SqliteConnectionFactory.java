package de.bsommerfeld.socialnetwork.db;

import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens connections to the SQLite store file.
 *
 * <p>
 * Every call hands out a fresh {@link Connection}; callers close it when
 * their operation is done. SQLite serializes writers at the file level, so a
 * pool would add nothing for this workload. Foreign keys are enforced on every
 * connection, since SQLite leaves them off unless asked per connection.
 */
public class SqliteConnectionFactory {

    private final Path databaseFile;
    private final String url;
    private final Properties properties;

    public SqliteConnectionFactory(Path databaseFile) {
        this.databaseFile = databaseFile.toAbsolutePath();
        this.url = "jdbc:sqlite:" + this.databaseFile;

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        this.properties = config.toProperties();
    }

    /**
     * Opens a new connection. Creates the file if it does not exist yet, so
     * existence checks must happen before the first call.
     */
    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, properties);
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    public String getUrl() {
        return url;
    }
}
