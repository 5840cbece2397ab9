package de.bsommerfeld.socialnetwork.server.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /users}.
 *
 * @param username required, non-blank, at most {@value #MAX_USERNAME_LENGTH}
 *                 characters
 * @param role     optional; the store default applies when absent
 */
public record CreateUserRequest(
        @JsonProperty("username") String username,
        @JsonProperty("role") String role) {

    /** Matches {@code users.username VARCHAR(50)}. */
    public static final int MAX_USERNAME_LENGTH = 50;

    /**
     * @throws de.bsommerfeld.socialnetwork.server.ApiException 400 if
     *         {@code username} is missing, blank or too long
     */
    public CreateUserRequest validate() {
        RequestBodies.requireText("username", username);
        RequestBodies.requireMaxLength("username", username, MAX_USERNAME_LENGTH);
        return this;
    }
}
