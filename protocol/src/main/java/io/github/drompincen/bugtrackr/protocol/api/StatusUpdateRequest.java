package io.github.drompincen.bugtrackr.protocol.api;

public record StatusUpdateRequest(BugStatus status, String userId, String userRole) {}
