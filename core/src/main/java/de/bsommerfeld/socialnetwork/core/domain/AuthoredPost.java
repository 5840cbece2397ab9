package de.bsommerfeld.socialnetwork.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A {@link Post} flattened together with its author's username. Every post
 * endpoint answers with this shape.
 */
public record AuthoredPost(
        @JsonProperty("id") long id,
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("user_id") long userId,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("username") String username) {
}
