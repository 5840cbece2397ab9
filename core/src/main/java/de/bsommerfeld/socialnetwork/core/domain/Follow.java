package de.bsommerfeld.socialnetwork.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed edge in the follow graph: {@code followingUserId} follows
 * {@code followedUserId}. The pair is unique. Edges only come from seed data.
 */
public record Follow(
        @JsonProperty("following_user_id") long followingUserId,
        @JsonProperty("followed_user_id") long followedUserId,
        @JsonProperty("created_at") String createdAt) {
}
