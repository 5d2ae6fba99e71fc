package io.github.drompincen.bugtrackr.runtime;

import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

/** Argument checks for incoming requests. */
public final class Requests {

    private Requests() {}

    public static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be empty");
        }
        return value;
    }

    public static <T> T require(String field, T value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }
}
