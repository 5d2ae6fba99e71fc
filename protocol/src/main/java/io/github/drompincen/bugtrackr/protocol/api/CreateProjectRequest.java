package io.github.drompincen.bugtrackr.protocol.api;

public record CreateProjectRequest(String name, String description, String createdBy) {}
