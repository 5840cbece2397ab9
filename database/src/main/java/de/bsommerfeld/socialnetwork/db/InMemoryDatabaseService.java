package de.bsommerfeld.socialnetwork.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.socialnetwork.core.domain.AuthoredPost;
import de.bsommerfeld.socialnetwork.core.domain.DuplicateUsernameException;
import de.bsommerfeld.socialnetwork.core.domain.Follow;
import de.bsommerfeld.socialnetwork.core.domain.Post;
import de.bsommerfeld.socialnetwork.core.domain.SeedData;
import de.bsommerfeld.socialnetwork.core.domain.UnknownUserException;
import de.bsommerfeld.socialnetwork.core.domain.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite.
 * Bound by Guice when the service starts with {@code app.mode=TEST}.
 *
 * <p>
 * The constructor seeds the same {@link SeedData} rows a fresh SQLite store
 * receives, and writes follow the same rules: usernames are unique and posts
 * must reference an existing user. Timestamps use the store's
 * {@code yyyy-MM-dd HH:mm:ss} UTC format so both implementations serialize
 * identically.
 *
 * <p>
 * All methods synchronize on the instance; this store is for demos and
 * tests, not throughput.
 */
@Singleton
public final class InMemoryDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDatabaseService.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Comparator<User> USERS_NEWEST_FIRST = Comparator
            .comparing(User::createdAt)
            .thenComparingLong(User::id)
            .reversed();

    private static final Comparator<Post> POSTS_NEWEST_FIRST = Comparator
            .comparing(Post::createdAt)
            .thenComparingLong(Post::id)
            .reversed();

    private static final Comparator<Follow> FOLLOWS_BY_PAIR = Comparator
            .comparingLong(Follow::followingUserId)
            .thenComparingLong(Follow::followedUserId);

    private final Clock clock;

    private final Map<Long, User> users = new LinkedHashMap<>();
    private final Map<Long, Post> posts = new LinkedHashMap<>();
    private final List<Follow> follows = new ArrayList<>();

    private long nextUserId = 1;
    private long nextPostId = 1;

    @Inject
    public InMemoryDatabaseService() {
        this(Clock.systemUTC());
    }

    InMemoryDatabaseService(Clock clock) {
        this.clock = clock;

        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");

        SeedData.USERS.forEach(u -> insertUser(u.username(), u.role()));
        SeedData.POSTS.forEach(p -> insertPost(p.title(), p.body(), p.userId()));
        String now = now();
        SeedData.FOLLOWS.forEach(f -> follows.add(new Follow(f.followingUserId(), f.followedUserId(), now)));
    }

    @Override
    public synchronized List<User> getUsers() {
        List<User> result = new ArrayList<>(users.values());
        result.sort(USERS_NEWEST_FIRST);
        return result;
    }

    @Override
    public synchronized User createUser(String username, String role) {
        return insertUser(username, role);
    }

    private User insertUser(String username, String role) {
        boolean taken = users.values().stream().anyMatch(u -> u.username().equals(username));
        if (taken) {
            throw new DuplicateUsernameException(username, null);
        }
        User user = new User(nextUserId++, username, role != null ? role : User.DEFAULT_ROLE, now());
        users.put(user.id(), user);
        return user;
    }

    @Override
    public synchronized List<AuthoredPost> getPosts() {
        List<Post> sorted = new ArrayList<>(posts.values());
        sorted.sort(POSTS_NEWEST_FIRST);

        List<AuthoredPost> result = new ArrayList<>(sorted.size());
        for (Post p : sorted) {
            result.add(p.withAuthor(users.get(p.userId()).username()));
        }
        return result;
    }

    @Override
    public synchronized AuthoredPost createPost(String title, String body, long userId) {
        return insertPost(title, body, userId);
    }

    private AuthoredPost insertPost(String title, String body, long userId) {
        User author = users.get(userId);
        if (author == null) {
            throw new UnknownUserException(userId, null);
        }
        Post post = new Post(nextPostId++, title, body, userId, now());
        posts.put(post.id(), post);
        return post.withAuthor(author.username());
    }

    @Override
    public synchronized List<Follow> getFollows() {
        List<Follow> result = new ArrayList<>(follows);
        result.sort(FOLLOWS_BY_PAIR);
        return result;
    }

    private String now() {
        return LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).format(TIMESTAMP);
    }
}
