package io.github.drompincen.bugtrackr.protocol.api;

public record CreateBugRequest(
        String title,
        String description,
        String projectId,
        String reportedBy,
        BugPriority priority,
        BugSeverity severity
) {}
