package io.github.drompincen.bugtrackr.protocol.api;

import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

/** Construction-time attribute checks shared by the entity records. */
final class EntityChecks {

    private EntityChecks() {}

    static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be empty");
        }
        return value;
    }

    static String requireText(String field, String value, int maxLength) {
        requireText(field, value);
        if (value.length() > maxLength) {
            throw new ValidationException(field + " must be at most " + maxLength + " characters");
        }
        return value;
    }

    static <T> T require(String field, T value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    static String optionalId(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
