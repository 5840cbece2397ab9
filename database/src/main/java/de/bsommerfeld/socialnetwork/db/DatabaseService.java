package de.bsommerfeld.socialnetwork.db;

import de.bsommerfeld.socialnetwork.core.domain.AuthoredPost;
import de.bsommerfeld.socialnetwork.core.domain.DuplicateUsernameException;
import de.bsommerfeld.socialnetwork.core.domain.Follow;
import de.bsommerfeld.socialnetwork.core.domain.UnknownUserException;
import de.bsommerfeld.socialnetwork.core.domain.User;

import java.util.List;

/**
 * Persistence contract behind the HTTP API. Implementations must be
 * thread-safe: handlers call into it from the server's worker threads without
 * any coordination.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: the SQLite store file</li>
 * <li>{@link InMemoryDatabaseService}: TEST mode, seeded, no disk I/O</li>
 * </ul>
 * The Guice module picks one based on the application mode.
 *
 * <p>
 * User and post lists are ordered newest first by creation time, ties broken
 * by the higher id, so rows inserted within the same second still come back
 * in reverse insertion order.
 */
public interface DatabaseService {

    /**
     * Returns all users, newest first.
     */
    List<User> getUsers();

    /**
     * Creates a user and returns it as stored, including its generated id and
     * creation time.
     *
     * @param username unique display name
     * @param role     role label; {@code null} stores {@link User#DEFAULT_ROLE}
     * @throws DuplicateUsernameException if the username is taken; nothing is
     *                                    persisted in that case
     */
    User createUser(String username, String role);

    /**
     * Returns all posts joined with their author's username, newest first.
     */
    List<AuthoredPost> getPosts();

    /**
     * Creates a post and returns it joined with its author's username.
     *
     * @throws UnknownUserException if {@code userId} does not reference a user
     */
    AuthoredPost createPost(String title, String body, long userId);

    /**
     * Returns every follow edge ordered by follower id, then followed id.
     */
    List<Follow> getFollows();
}
