package io.github.drompincen.bugtrackr.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.error.MalformedDataException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON object serialized into a single text field of a stored item, for attributes the
 * store has no native field for.
 */
final class OverflowPayload {

    static final String FIELD = "description";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    OverflowPayload(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Whether the field holds something that is meant to be a JSON object. */
    static boolean present(StoredItem item) {
        return item.get(FIELD) instanceof String text && text.stripLeading().startsWith("{");
    }

    Map<String, Object> read(StoredItem item) {
        Object raw = item.get(FIELD);
        if (!(raw instanceof String text) || text.isBlank()) {
            throw new MalformedDataException(item.describeId(), FIELD, "overflow payload is missing");
        }
        try {
            Map<String, Object> payload = objectMapper.readValue(text, MAP_TYPE);
            if (payload == null) {
                throw new MalformedDataException(item.describeId(), FIELD, "overflow payload is not a JSON object");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new MalformedDataException(item.describeId(), FIELD,
                    "overflow payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    String write(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize overflow payload", e);
        }
    }

    static String requiredAttribute(StoredItem item, Map<String, Object> payload, String attribute) {
        Object value = payload.get(attribute);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new MalformedDataException(item.describeId(), FIELD + "." + attribute,
                    "required attribute is missing from overflow payload");
        }
        return text;
    }
}
