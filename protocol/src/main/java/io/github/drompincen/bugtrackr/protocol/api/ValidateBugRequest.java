package io.github.drompincen.bugtrackr.protocol.api;

public record ValidateBugRequest(String userId, String userRole) {}
