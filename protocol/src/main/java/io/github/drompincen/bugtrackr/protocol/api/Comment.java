package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Comment(
        @JsonProperty("_id") String id,
        String bugId,
        String authorId,
        String message,
        Instant createdAt
) {
    public Comment {
        id = EntityChecks.optionalId(id);
        EntityChecks.requireText("bugId", bugId);
        EntityChecks.requireText("authorId", authorId);
        EntityChecks.requireText("message", message);
    }
}
