package de.bsommerfeld.socialnetwork.server.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import de.bsommerfeld.socialnetwork.server.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Binds raw request bodies to request records and checks required fields.
 * Every failure becomes a 400 {@link ApiException} whose detail names what is
 * wrong.
 */
public final class RequestBodies {

    private static final Logger LOG = LoggerFactory.getLogger(RequestBodies.class);

    private RequestBodies() {
    }

    /**
     * Parses {@code body} into {@code type}.
     *
     * @throws ApiException 400 if the body is empty, not JSON, or has a field
     *                      of the wrong type
     */
    public static <T> T parse(ObjectMapper mapper, String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw ApiException.badRequest("Request body is required");
        }

        T value;
        try {
            value = mapper.readValue(body, type);
        } catch (MismatchedInputException e) {
            String field = fieldOf(e.getPath());
            LOG.warn("Rejected {} body: {}", type.getSimpleName(), e.getOriginalMessage());
            throw ApiException.badRequest(field != null ? "Invalid value for " + field : "Malformed JSON body");
        } catch (JsonProcessingException e) {
            LOG.warn("Rejected {} body: {}", type.getSimpleName(), e.getOriginalMessage());
            throw ApiException.badRequest("Malformed JSON body");
        }

        if (value == null) {
            throw ApiException.badRequest("Request body is required");
        }
        return value;
    }

    /** Rejects a missing or blank text field. */
    static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest(field + " is required");
        }
        return value;
    }

    /** Rejects text longer than {@code max} characters. */
    static String requireMaxLength(String field, String value, int max) {
        if (value.length() > max) {
            throw ApiException.badRequest(field + " is too long");
        }
        return value;
    }

    /** Rejects a missing field. */
    static <T> T requireValue(String field, T value) {
        if (value == null) {
            throw ApiException.badRequest(field + " is required");
        }
        return value;
    }

    private static String fieldOf(List<JsonMappingException.Reference> path) {
        if (path == null || path.isEmpty())
            return null;
        return path.get(path.size() - 1).getFieldName();
    }
}
