package de.bsommerfeld.socialnetwork.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the service. Decides which store backs the API:
 * {@link #PROD} persists to the SQLite file, {@link #TEST} keeps everything
 * in memory and forgets it on shutdown.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code app.mode} system property, then the
     * {@code APP_MODE} environment variable. Unset or unknown values resolve
     * to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = ServerConfig.lookup("app.mode", "APP_MODE");
        if (mode == null) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
