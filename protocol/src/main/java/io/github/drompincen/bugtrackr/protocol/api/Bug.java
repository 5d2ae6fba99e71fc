package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A reported bug. {@code id} is null until the bug has been persisted; once assigned it
 * never changes.
 */
public record Bug(
        @JsonProperty("_id") String id,
        String title,
        String description,
        String projectId,
        String reportedBy,
        String assignedTo,
        BugStatus status,
        BugPriority priority,
        BugSeverity severity,
        List<String> tags,
        boolean validated,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int MAX_TITLE_LENGTH = 200;

    public Bug {
        id = EntityChecks.optionalId(id);
        EntityChecks.requireText("title", title, MAX_TITLE_LENGTH);
        EntityChecks.requireText("description", description);
        EntityChecks.requireText("projectId", projectId);
        EntityChecks.requireText("reportedBy", reportedBy);
        assignedTo = EntityChecks.optionalId(assignedTo);
        status = status != null ? status : BugStatus.OPEN;
        EntityChecks.require("priority", priority);
        EntityChecks.require("severity", severity);
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** A freshly reported bug: Open, not validated, both timestamps at {@code now}. */
    public static Bug open(String title, String description, String projectId, String reportedBy,
                           BugPriority priority, BugSeverity severity, Instant now) {
        return new Bug(null, title, description, projectId, reportedBy, null, BugStatus.OPEN,
                priority, severity, List.of(), false, now, now);
    }

    /** Later of {@code candidate} and the current last-modified time. */
    public Instant nextModification(Instant candidate) {
        Objects.requireNonNull(candidate, "candidate");
        return updatedAt != null && updatedAt.isAfter(candidate) ? updatedAt : candidate;
    }
}
