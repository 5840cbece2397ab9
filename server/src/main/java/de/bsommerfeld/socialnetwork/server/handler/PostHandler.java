package de.bsommerfeld.socialnetwork.server.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.core.domain.AuthoredPost;
import de.bsommerfeld.socialnetwork.core.domain.UnknownUserException;
import de.bsommerfeld.socialnetwork.db.DatabaseService;
import de.bsommerfeld.socialnetwork.server.ApiException;
import de.bsommerfeld.socialnetwork.server.request.CreatePostRequest;
import de.bsommerfeld.socialnetwork.server.request.RequestBodies;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /posts} and {@code POST /posts}. Both answer with posts joined
 * with their author's username.
 */
@Singleton
public class PostHandler {

    private static final Logger LOG = LoggerFactory.getLogger(PostHandler.class);

    static final String UNKNOWN_USER = "User does not exist";

    private final DatabaseService databaseService;
    private final ObjectMapper mapper;

    @Inject
    public PostHandler(DatabaseService databaseService, ObjectMapper mapper) {
        this.databaseService = databaseService;
        this.mapper = mapper;
    }

    public void list(Context ctx) {
        ctx.json(databaseService.getPosts());
    }

    public void create(Context ctx) {
        CreatePostRequest request = RequestBodies.parse(mapper, ctx.body(), CreatePostRequest.class).validate();

        AuthoredPost created;
        try {
            created = databaseService.createPost(request.title(), request.body(), request.userId());
        } catch (UnknownUserException e) {
            LOG.warn("Rejected post for unknown user {}", e.getUserId());
            throw ApiException.badRequest(UNKNOWN_USER);
        }

        LOG.info("Created post {} by '{}'", created.id(), created.username());
        ctx.json(created);
    }
}
