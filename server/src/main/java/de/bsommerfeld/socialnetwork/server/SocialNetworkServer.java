package de.bsommerfeld.socialnetwork.server;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.socialnetwork.server.config.ServerModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Creating the injector initializes the store (it is an eager
 * singleton), so a store that cannot be created stops the process before the
 * port is bound.
 */
public final class SocialNetworkServer {

    private static final Logger LOG = LoggerFactory.getLogger(SocialNetworkServer.class);

    private SocialNetworkServer() {
    }

    public static void main(String[] args) {
        LOG.info("Starting Social Network API...");

        Injector injector;
        try {
            injector = Guice.createInjector(new ServerModule());
        } catch (CreationException e) {
            LOG.error("Startup failed, store could not be initialized", e);
            System.exit(1);
            return;
        }

        ApiServer server = injector.getInstance(ApiServer.class);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "api-shutdown"));
    }
}
