package de.bsommerfeld.socialnetwork.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StoreInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void initialize_shouldCreateAndSeedMissingStore() throws SQLException {
        Path file = tempDir.resolve("social_network.db");
        SqliteConnectionFactory connections = new SqliteConnectionFactory(file);

        assertTrue(new StoreInitializer(connections).initialize());
        assertTrue(Files.exists(file));

        assertEquals(3, count(connections, "users"));
        assertEquals(3, count(connections, "posts"));
        assertEquals(3, count(connections, "follows"));
    }

    @Test
    void initialize_shouldLeaveExistingStoreUntouched() throws SQLException {
        Path file = tempDir.resolve("social_network.db");
        SqliteConnectionFactory connections = new SqliteConnectionFactory(file);
        new StoreInitializer(connections).initialize();

        assertFalse(new StoreInitializer(connections).initialize());
        assertEquals(3, count(connections, "users"), "seed rows must not be duplicated");
    }

    @Test
    void initialize_shouldNotTouchExistingFileEvenIfEmpty() throws Exception {
        Path file = tempDir.resolve("empty.db");
        Files.createFile(file);

        assertFalse(new StoreInitializer(new SqliteConnectionFactory(file)).initialize());
        assertEquals(0, Files.size(file));
    }

    @Test
    void initialize_shouldCreateMissingParentDirectories() {
        Path file = tempDir.resolve("nested/dir/social_network.db");

        assertTrue(new StoreInitializer(new SqliteConnectionFactory(file)).initialize());
        assertTrue(Files.exists(file));
    }

    @Test
    void initialize_shouldFailWhenParentIsAFile() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        Path file = blocker.resolve("social_network.db");

        assertThrows(StoreInitializationException.class,
                () -> new StoreInitializer(new SqliteConnectionFactory(file)).initialize());
    }

    @Test
    void initialize_shouldRemovePartialFileOnFailure() throws Exception {
        Path file = tempDir.resolve("partial.db");
        SqliteConnectionFactory connections = mock(SqliteConnectionFactory.class);
        when(connections.getDatabaseFile()).thenReturn(file);
        when(connections.open()).thenAnswer(inv -> {
            Files.createFile(file);
            throw new SQLException("disk I/O error");
        });

        StoreInitializationException e = assertThrows(StoreInitializationException.class,
                () -> new StoreInitializer(connections).initialize());

        assertInstanceOf(SQLException.class, e.getCause());
        assertFalse(Files.exists(file), "a half-created store must not survive a failed start");
    }

    private static int count(SqliteConnectionFactory connections, String table) throws SQLException {
        try (Connection conn = connections.open();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
