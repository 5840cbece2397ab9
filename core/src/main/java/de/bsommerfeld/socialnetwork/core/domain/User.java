package de.bsommerfeld.socialnetwork.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A registered account. Rows are created through the API or by the seed
 * routine and are never updated or deleted afterwards.
 *
 * @param id        store-assigned identity, strictly positive
 * @param username  display name, unique across all users
 * @param role      free-form role label, {@code "user"} unless given
 * @param createdAt creation time as written by the store
 *                  ({@code yyyy-MM-dd HH:mm:ss}, UTC)
 */
public record User(
        @JsonProperty("id") long id,
        @JsonProperty("username") String username,
        @JsonProperty("role") String role,
        @JsonProperty("created_at") String createdAt) {

    /** Role assigned when a create request does not name one. */
    public static final String DEFAULT_ROLE = "user";
}
