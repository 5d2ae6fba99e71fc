package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Audit entry recording who did what to a bug. */
public record ActivityLog(
        @JsonProperty("_id") String id,
        String bugId,
        String action,
        String performedBy,
        Instant timestamp
) {
    public static final String STATUS_CHANGED = "status_changed";
    public static final String BUG_VALIDATED = "bug_validated";
    public static final String BUG_ASSIGNED = "bug_assigned";

    public ActivityLog {
        id = EntityChecks.optionalId(id);
        EntityChecks.requireText("bugId", bugId);
        EntityChecks.requireText("action", action);
        EntityChecks.requireText("performedBy", performedBy);
    }
}
