package de.bsommerfeld.socialnetwork.db;

/**
 * Unchecked wrapper for store failures that callers cannot act on, such as
 * an unreadable file or a malformed statement.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
