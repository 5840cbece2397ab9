package de.bsommerfeld.socialnetwork.server.handler;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.db.DatabaseService;
import io.javalin.http.Context;

/**
 * {@code GET /follows}: the seeded follow graph, read-only.
 */
@Singleton
public class FollowHandler {

    private final DatabaseService databaseService;

    @Inject
    public FollowHandler(DatabaseService databaseService) {
        this.databaseService = databaseService;
    }

    public void list(Context ctx) {
        ctx.json(databaseService.getFollows());
    }
}
