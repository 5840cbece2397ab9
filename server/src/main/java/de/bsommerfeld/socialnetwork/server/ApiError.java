package de.bsommerfeld.socialnetwork.server;

/**
 * Error body for every non-2xx response.
 */
public record ApiError(String detail) {
}
