package de.bsommerfeld.socialnetwork.core.domain;

import java.util.List;

/**
 * Fixed rows written into a freshly created store, and nowhere else.
 * Post and follow entries refer to users by their 1-based position in
 * {@link #USERS}, which equals the id the store hands out on a fresh file.
 */
public final class SeedData {

    public record SeedUser(String username, String role) {
    }

    public record SeedPost(String title, String body, long userId) {
    }

    public record SeedFollow(long followingUserId, long followedUserId) {
    }

    public static final List<SeedUser> USERS = List.of(
            new SeedUser("juan_dev", "user"),
            new SeedUser("maria_admin", "admin"),
            new SeedUser("carlos_student", "user"));

    public static final List<SeedPost> POSTS = List.of(
            new SeedPost("Mi primer post", "Hola mundo desde la API con SQLite!", 1),
            new SeedPost("Segundo post", "Este proyecto está genial", 2),
            new SeedPost("Aprendiendo FastAPI", "Es más fácil de lo que pensé", 3));

    public static final List<SeedFollow> FOLLOWS = List.of(
            new SeedFollow(1, 2),
            new SeedFollow(1, 3),
            new SeedFollow(2, 3));

    private SeedData() {
    }
}
