package de.bsommerfeld.socialnetwork.core.domain;

/**
 * A post as stored, without any joined author data.
 *
 * @param id        store-assigned identity
 * @param title     headline, at most 100 characters
 * @param body      post text
 * @param userId    id of the owning {@link User}
 * @param createdAt creation time as written by the store
 */
public record Post(
        long id,
        String title,
        String body,
        long userId,
        String createdAt) {

    /**
     * Attaches the author's username, producing the shape served over HTTP.
     */
    public AuthoredPost withAuthor(String username) {
        return new AuthoredPost(id, title, body, userId, createdAt, username);
    }
}
