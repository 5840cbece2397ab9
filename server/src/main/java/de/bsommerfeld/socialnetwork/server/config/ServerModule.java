package de.bsommerfeld.socialnetwork.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.core.config.ApplicationMode;
import de.bsommerfeld.socialnetwork.core.config.ServerConfig;
import de.bsommerfeld.socialnetwork.db.DatabaseService;
import de.bsommerfeld.socialnetwork.db.InMemoryDatabaseService;
import de.bsommerfeld.socialnetwork.db.SqlDatabaseService;
import de.bsommerfeld.socialnetwork.server.JsonMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module for the HTTP service.
 */
public class ServerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ServerModule.class);

    private final ServerConfig config;
    private final ApplicationMode mode;

    public ServerModule() {
        this(ServerConfig.load(), ApplicationMode.get());
    }

    public ServerModule(ServerConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        LOG.info("Loaded configuration: {}", config);
        bind(ServerConfig.class).toInstance(config);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(DatabaseService.class).to(InMemoryDatabaseService.class).asEagerSingleton();
        } else {
            // Eager so the store file exists before the port is bound
            bind(DatabaseService.class).to(SqlDatabaseService.class).asEagerSingleton();
        }
    }

    @Provides
    @Singleton
    ObjectMapper objectMapper() {
        return JsonMapping.create();
    }
}
