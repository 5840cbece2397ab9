package de.bsommerfeld.socialnetwork.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;

/**
 * Builds the one {@link ObjectMapper} used for request bodies and responses.
 * Field names come from {@code @JsonProperty} on the records; unknown request
 * fields are ignored.
 *
 * <p>
 * Integer fields only accept JSON integers. A fractional number or a quoted
 * number fails binding instead of being truncated or parsed.
 */
public final class JsonMapping {

    private JsonMapping() {
    }

    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        return mapper;
    }
}
