package de.bsommerfeld.socialnetwork.db;

import de.bsommerfeld.socialnetwork.core.domain.SeedData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates and seeds the store on first start.
 *
 * <p>
 * The check is on the store <em>file</em>: if it exists, nothing happens, no
 * matter what it contains. There is no migration and no re-seeding. If it does
 * not exist, {@code schema.sql} and the {@link SeedData} rows are written in a
 * single transaction.
 *
 * <p>
 * Any failure is fatal. The half-written file is removed before the
 * {@link StoreInitializationException} propagates, so the next start begins
 * from scratch instead of finding an empty store and skipping creation.
 */
public class StoreInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(StoreInitializer.class);

    static final String SCHEMA_RESOURCE = "schema.sql";

    private final SqliteConnectionFactory connections;

    public StoreInitializer(SqliteConnectionFactory connections) {
        this.connections = connections;
    }

    /**
     * Creates the store if its file is absent.
     *
     * @return {@code true} if the store was created and seeded, {@code false}
     *         if an existing file was left untouched
     * @throws StoreInitializationException if creation fails
     */
    public boolean initialize() {
        Path file = connections.getDatabaseFile();
        if (Files.exists(file)) {
            LOG.info("Using existing store at {}", file);
            return false;
        }

        LOG.info("Store not found, creating {}", file);
        createParentDirectories(file);

        try (Connection conn = connections.open()) {
            conn.setAutoCommit(false);
            try {
                applySchema(conn);
                seed(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            discard(file);
            throw new StoreInitializationException("Failed to initialize store at " + file, e);
        }

        LOG.info("Store created with {} users, {} posts, {} follows.",
                SeedData.USERS.size(), SeedData.POSTS.size(), SeedData.FOLLOWS.size());
        return true;
    }

    private void createParentDirectories(Path file) {
        Path parent = file.getParent();
        if (parent == null || Files.isDirectory(parent))
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreInitializationException("Failed to create directory " + parent, e);
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.script(SCHEMA_RESOURCE)) {
                stmt.execute(sql);
            }
        }
        LOG.debug("Schema applied.");
    }

    private void seed(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-user"))) {
            for (SeedData.SeedUser u : SeedData.USERS) {
                ps.setString(1, u.username());
                ps.setString(2, u.role());
                ps.addBatch();
            }
            ps.executeBatch();
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-post"))) {
            for (SeedData.SeedPost p : SeedData.POSTS) {
                ps.setString(1, p.title());
                ps.setString(2, p.body());
                ps.setLong(3, p.userId());
                ps.addBatch();
            }
            ps.executeBatch();
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-follow"))) {
            for (SeedData.SeedFollow f : SeedData.FOLLOWS) {
                ps.setLong(1, f.followingUserId());
                ps.setLong(2, f.followedUserId());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not remove partially created store {}", file, e);
        }
    }
}
