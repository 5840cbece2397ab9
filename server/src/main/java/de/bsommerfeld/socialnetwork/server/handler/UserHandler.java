package de.bsommerfeld.socialnetwork.server.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.core.domain.DuplicateUsernameException;
import de.bsommerfeld.socialnetwork.core.domain.User;
import de.bsommerfeld.socialnetwork.db.DatabaseService;
import de.bsommerfeld.socialnetwork.server.ApiException;
import de.bsommerfeld.socialnetwork.server.request.CreateUserRequest;
import de.bsommerfeld.socialnetwork.server.request.RequestBodies;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /users} and {@code POST /users}.
 */
@Singleton
public class UserHandler {

    private static final Logger LOG = LoggerFactory.getLogger(UserHandler.class);

    static final String DUPLICATE_USERNAME = "Username already exists";

    private final DatabaseService databaseService;
    private final ObjectMapper mapper;

    @Inject
    public UserHandler(DatabaseService databaseService, ObjectMapper mapper) {
        this.databaseService = databaseService;
        this.mapper = mapper;
    }

    /** Lists every user, newest first. */
    public void list(Context ctx) {
        ctx.json(databaseService.getUsers());
    }

    /**
     * Creates a user and answers with the stored row. A taken username is
     * answered with 400 and nothing is written.
     */
    public void create(Context ctx) {
        CreateUserRequest request = RequestBodies.parse(mapper, ctx.body(), CreateUserRequest.class).validate();

        User created;
        try {
            created = databaseService.createUser(request.username(), request.role());
        } catch (DuplicateUsernameException e) {
            LOG.warn("Rejected duplicate username '{}'", e.getUsername());
            throw ApiException.badRequest(DUPLICATE_USERNAME);
        }

        LOG.info("Created user {} '{}' with role {}", created.id(), created.username(), created.role());
        ctx.json(created);
    }
}
