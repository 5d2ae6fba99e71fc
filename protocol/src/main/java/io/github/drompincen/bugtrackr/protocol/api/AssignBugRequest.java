package io.github.drompincen.bugtrackr.protocol.api;

public record AssignBugRequest(String assignedTo, String assignedBy) {}
