package de.bsommerfeld.socialnetwork.server.handler;

import com.google.inject.Singleton;
import io.javalin.http.Context;

/**
 * {@code GET /}: confirms the process is up. Does not touch the store.
 */
@Singleton
public class HealthHandler {

    public record HealthStatus(String message, String status) {
    }

    static final HealthStatus RUNNING = new HealthStatus("Social Network API is running!", "ok");

    public void health(Context ctx) {
        ctx.json(RUNNING);
    }
}
