package de.bsommerfeld.socialnetwork.server.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /posts}. All fields are required; {@code title} is
 * limited to {@value #MAX_TITLE_LENGTH} characters.
 */
public record CreatePostRequest(
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("user_id") Long userId) {

    /** Matches {@code posts.title VARCHAR(100)}. */
    public static final int MAX_TITLE_LENGTH = 100;

    public CreatePostRequest validate() {
        RequestBodies.requireText("title", title);
        RequestBodies.requireMaxLength("title", title, MAX_TITLE_LENGTH);
        RequestBodies.requireText("body", body);
        RequestBodies.requireValue("user_id", userId);
        return this;
    }
}
