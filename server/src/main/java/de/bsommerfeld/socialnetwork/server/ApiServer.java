package de.bsommerfeld.socialnetwork.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.core.config.ServerConfig;
import de.bsommerfeld.socialnetwork.server.handler.FollowHandler;
import de.bsommerfeld.socialnetwork.server.handler.HealthHandler;
import de.bsommerfeld.socialnetwork.server.handler.PostHandler;
import de.bsommerfeld.socialnetwork.server.handler.UserHandler;
import io.javalin.Javalin;
import io.javalin.http.HttpStatus;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the service: binds the handlers to their routes, opens CORS
 * to every origin, and turns exceptions into JSON error bodies.
 *
 * <h3>Routes</h3>
 * <ul>
 * <li>{@code GET /}: health check</li>
 * <li>{@code GET /users}, {@code POST /users}</li>
 * <li>{@code GET /posts}, {@code POST /posts}</li>
 * <li>{@code GET /follows}</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * {@link ApiException} carries its own status. Anything else is logged and
 * answered with 500. Unmatched routes get 404. Every error body has the shape
 * {@code {"detail": "..."}}.
 */
@Singleton
public class ApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(ApiServer.class);

    private final ServerConfig config;
    private final ObjectMapper mapper;
    private final HealthHandler healthHandler;
    private final UserHandler userHandler;
    private final PostHandler postHandler;
    private final FollowHandler followHandler;

    private Javalin app;

    @Inject
    public ApiServer(ServerConfig config, ObjectMapper mapper, HealthHandler healthHandler,
            UserHandler userHandler, PostHandler postHandler, FollowHandler followHandler) {
        this.config = config;
        this.mapper = mapper;
        this.healthHandler = healthHandler;
        this.userHandler = userHandler;
        this.postHandler = postHandler;
        this.followHandler = followHandler;
    }

    Javalin createApp() {
        Javalin javalin = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.jsonMapper(new JavalinJackson(mapper, false));
            cfg.bundledPlugins.enableCors(cors -> cors.addRule(rule -> rule.anyHost()));
        });

        javalin.get("/", healthHandler::health);
        javalin.get("/users", userHandler::list);
        javalin.post("/users", userHandler::create);
        javalin.get("/posts", postHandler::list);
        javalin.post("/posts", postHandler::create);
        javalin.get("/follows", followHandler::list);

        javalin.exception(ApiException.class, (e, ctx) -> {
            ctx.status(e.getStatus());
            ctx.json(new ApiError(e.getMessage()));
        });
        javalin.exception(Exception.class, (e, ctx) -> {
            LOG.error("Request {} {} failed", ctx.method(), ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR);
            ctx.json(new ApiError("Internal Server Error"));
        });
        javalin.error(HttpStatus.NOT_FOUND, ctx -> ctx.json(new ApiError("Not Found")));

        return javalin;
    }

    /**
     * Binds to the configured host and port. Port {@code 0} picks a free
     * port; {@link #port()} reports the one actually bound.
     */
    public synchronized void start() {
        if (app != null) {
            throw new IllegalStateException("Server already started");
        }
        app = createApp();
        app.start(config.getHost(), config.getPort());
        LOG.info("Social Network API listening on http://{}:{}", config.getHost(), app.port());
    }

    public synchronized void stop() {
        if (app == null)
            return;
        LOG.info("Stopping Social Network API...");
        app.stop();
        app = null;
    }

    public synchronized int port() {
        if (app == null) {
            throw new IllegalStateException("Server not started");
        }
        return app.port();
    }
}
