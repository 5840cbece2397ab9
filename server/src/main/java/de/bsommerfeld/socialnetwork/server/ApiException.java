package de.bsommerfeld.socialnetwork.server;

import io.javalin.http.HttpStatus;

/**
 * A request that cannot be served, with the status and detail message the
 * client receives. {@link ApiServer} renders it as {@code {"detail": ...}}.
 */
public class ApiException extends RuntimeException {

    private final HttpStatus status;

    public ApiException(HttpStatus status, String detail) {
        super(detail);
        this.status = status;
    }

    public static ApiException badRequest(String detail) {
        return new ApiException(HttpStatus.BAD_REQUEST, detail);
    }

    public HttpStatus getStatus() {
        return status;
    }
}
