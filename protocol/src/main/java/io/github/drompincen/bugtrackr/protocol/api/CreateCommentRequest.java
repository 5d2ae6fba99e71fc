package io.github.drompincen.bugtrackr.protocol.api;

public record CreateCommentRequest(String bugId, String authorId, String message) {}
