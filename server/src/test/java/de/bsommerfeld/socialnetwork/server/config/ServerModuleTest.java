package de.bsommerfeld.socialnetwork.server.config;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.socialnetwork.core.config.ApplicationMode;
import de.bsommerfeld.socialnetwork.core.config.ServerConfig;
import de.bsommerfeld.socialnetwork.db.DatabaseService;
import de.bsommerfeld.socialnetwork.db.InMemoryDatabaseService;
import de.bsommerfeld.socialnetwork.db.SqlDatabaseService;
import de.bsommerfeld.socialnetwork.server.ApiServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ServerModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void testMode_shouldBindInMemoryStoreAndLeaveDiskUntouched() {
        Path db = tempDir.resolve("social_network.db");
        Injector injector = Guice.createInjector(
                new ServerModule(new ServerConfig("127.0.0.1", 0, db), ApplicationMode.TEST));

        assertInstanceOf(InMemoryDatabaseService.class, injector.getInstance(DatabaseService.class));
        assertEquals(3, injector.getInstance(DatabaseService.class).getUsers().size());
        assertFalse(Files.exists(db));
    }

    @Test
    void prodMode_shouldBindSqliteStoreAndCreateItEagerly() {
        Path db = tempDir.resolve("social_network.db");
        Injector injector = Guice.createInjector(
                new ServerModule(new ServerConfig("127.0.0.1", 0, db), ApplicationMode.PROD));

        assertTrue(Files.exists(db));
        assertInstanceOf(SqlDatabaseService.class, injector.getInstance(DatabaseService.class));
    }

    @Test
    void singletons_shouldBeShared() {
        Injector injector = Guice.createInjector(new ServerModule(
                new ServerConfig("127.0.0.1", 0, tempDir.resolve("db")), ApplicationMode.TEST));

        assertSame(injector.getInstance(DatabaseService.class), injector.getInstance(DatabaseService.class));
        assertSame(injector.getInstance(ApiServer.class), injector.getInstance(ApiServer.class));
    }

    @Test
    void prodMode_shouldFailInjectorWhenStoreCannotBeCreated() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        ServerConfig config = new ServerConfig("127.0.0.1", 0, blocker.resolve("social_network.db"));

        assertThrows(CreationException.class,
                () -> Guice.createInjector(new ServerModule(config, ApplicationMode.PROD)));
    }
}
