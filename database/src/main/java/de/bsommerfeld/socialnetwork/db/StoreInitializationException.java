package de.bsommerfeld.socialnetwork.db;

/**
 * Raised when a fresh store cannot be created or seeded. Fatal to startup.
 */
public class StoreInitializationException extends StoreException {

    public StoreInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
