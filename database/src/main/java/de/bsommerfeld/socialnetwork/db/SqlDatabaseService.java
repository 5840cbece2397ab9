package de.bsommerfeld.socialnetwork.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.core.config.ServerConfig;
import de.bsommerfeld.socialnetwork.core.domain.AuthoredPost;
import de.bsommerfeld.socialnetwork.core.domain.DuplicateUsernameException;
import de.bsommerfeld.socialnetwork.core.domain.Follow;
import de.bsommerfeld.socialnetwork.core.domain.UnknownUserException;
import de.bsommerfeld.socialnetwork.core.domain.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite-backed {@link DatabaseService}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * Construction runs the {@link StoreInitializer}, so a missing store file is
 * created and seeded before the first request can arrive.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. Nothing is shared between operations, so concurrent requests only
 * meet at SQLite's file lock.
 *
 * <h3>Transaction boundaries</h3>
 * Creates run insert and re-read in one transaction on one connection:
 * {@code last_insert_rowid()} is per connection, and the returned row is the
 * one this call wrote. Reads use auto-commit.
 *
 * <h3>Failures</h3>
 * Unique and foreign-key violations are translated into
 * {@link DuplicateUsernameException} and {@link UnknownUserException}. Any
 * other {@link SQLException} surfaces as a {@link StoreException}.
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    private final SqliteConnectionFactory connections;

    @Inject
    public SqlDatabaseService(ServerConfig config) {
        this(new SqliteConnectionFactory(config.getDatabaseFile()));
    }

    public SqlDatabaseService(SqliteConnectionFactory connections) {
        this.connections = connections;
        LOG.info("Initializing database at {}", connections.getUrl());
        new StoreInitializer(connections).initialize();
    }

    // =====================================================================
    // Users
    // =====================================================================

    @Override
    public List<User> getUsers() {
        List<User> users = new ArrayList<>();
        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-users"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                users.add(mapUser(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load users", e);
        }
        return users;
    }

    @Override
    public User createUser(String username, String role) {
        String effectiveRole = role != null ? role : User.DEFAULT_ROLE;

        try (Connection conn = connections.open()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-user"))) {
                    ps.setString(1, username);
                    ps.setString(2, effectiveRole);
                    ps.executeUpdate();
                }
                User created = selectUser(conn, lastInsertId(conn));
                conn.commit();
                LOG.debug("[DB] Created user {} ({})", created.id(), created.username());
                return created;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            if (violates(e, SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE, "UNIQUE")) {
                throw new DuplicateUsernameException(username, e);
            }
            throw new StoreException("Failed to create user " + username, e);
        }
    }

    private User selectUser(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-user"))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("User " + id + " vanished after insert");
                }
                return mapUser(rs);
            }
        }
    }

    // =====================================================================
    // Posts
    // =====================================================================

    @Override
    public List<AuthoredPost> getPosts() {
        List<AuthoredPost> posts = new ArrayList<>();
        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-posts"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                posts.add(mapPost(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load posts", e);
        }
        return posts;
    }

    @Override
    public AuthoredPost createPost(String title, String body, long userId) {
        try (Connection conn = connections.open()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-post"))) {
                    ps.setString(1, title);
                    ps.setString(2, body);
                    ps.setLong(3, userId);
                    ps.executeUpdate();
                }
                AuthoredPost created = selectPost(conn, lastInsertId(conn));
                conn.commit();
                LOG.debug("[DB] Created post {} for user {}", created.id(), userId);
                return created;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            if (violates(e, SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY, "FOREIGN KEY")) {
                throw new UnknownUserException(userId, e);
            }
            throw new StoreException("Failed to create post for user " + userId, e);
        }
    }

    private AuthoredPost selectPost(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-post"))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Post " + id + " vanished after insert");
                }
                return mapPost(rs);
            }
        }
    }

    // =====================================================================
    // Follows
    // =====================================================================

    @Override
    public List<Follow> getFollows() {
        List<Follow> follows = new ArrayList<>();
        try (Connection conn = connections.open();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-follows"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                follows.add(new Follow(
                        rs.getLong("following_user_id"),
                        rs.getLong("followed_user_id"),
                        rs.getString("created_at")));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load follows", e);
        }
        return follows;
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private long lastInsertId(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-insert-id"));
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong("id");
        }
    }

    private User mapUser(ResultSet rs) throws SQLException {
        return new User(
                rs.getLong("id"),
                rs.getString("username"),
                rs.getString("role"),
                rs.getString("created_at"));
    }

    private AuthoredPost mapPost(ResultSet rs) throws SQLException {
        return new AuthoredPost(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("body"),
                rs.getLong("user_id"),
                rs.getString("created_at"),
                rs.getString("username"));
    }

    /**
     * Whether {@code e} is the given constraint violation. Checks the extended
     * result code first and falls back to the primary constraint code plus the
     * message SQLite attaches to it.
     */
    static boolean violates(SQLException e, SQLiteErrorCode extended, String marker) {
        if (e instanceof SQLiteException sqlite && sqlite.getResultCode() == extended) {
            return true;
        }
        String message = e.getMessage();
        return (e.getErrorCode() & 0xFF) == SQLiteErrorCode.SQLITE_CONSTRAINT.code
                && message != null
                && message.contains(marker);
    }
}
