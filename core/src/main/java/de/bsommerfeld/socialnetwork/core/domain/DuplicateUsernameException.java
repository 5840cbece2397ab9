package de.bsommerfeld.socialnetwork.core.domain;

/**
 * Thrown when a user is created with a username that is already taken.
 * Nothing has been persisted when this is raised.
 */
public class DuplicateUsernameException extends RuntimeException {

    private final String username;

    public DuplicateUsernameException(String username, Throwable cause) {
        super("Username already exists: " + username, cause);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
