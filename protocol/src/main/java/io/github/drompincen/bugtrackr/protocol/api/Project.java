package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Project(
        @JsonProperty("_id") String id,
        String name,
        String description,
        String createdBy,
        Instant createdAt
) {
    public static final int MAX_NAME_LENGTH = 200;

    public Project {
        id = EntityChecks.optionalId(id);
        EntityChecks.requireText("name", name, MAX_NAME_LENGTH);
        EntityChecks.requireText("description", description);
        EntityChecks.requireText("createdBy", createdBy);
    }
}
