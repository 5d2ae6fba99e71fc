package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A member of the tracker. Users are seeded in the store; {@code role} is kept as stored
 * and resolved with {@link UserRole#fromWire(String)} where the workflow needs it.
 */
public record User(
        @JsonProperty("_id") String id,
        String name,
        String email,
        String role,
        Instant createdAt
) {
    public static final int MAX_NAME_LENGTH = 200;

    public User {
        id = EntityChecks.optionalId(id);
        EntityChecks.requireText("name", name, MAX_NAME_LENGTH);
        EntityChecks.requireText("email", email);
        EntityChecks.requireText("role", role);
    }
}
