package de.bsommerfeld.socialnetwork.core.domain;

/**
 * Thrown when a write references a user id that does not exist.
 */
public class UnknownUserException extends RuntimeException {

    private final long userId;

    public UnknownUserException(long userId, Throwable cause) {
        super("User does not exist: " + userId, cause);
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
