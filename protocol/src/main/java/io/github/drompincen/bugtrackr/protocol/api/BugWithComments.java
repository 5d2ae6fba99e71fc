package io.github.drompincen.bugtrackr.protocol.api;

import java.util.List;

public record BugWithComments(Bug bug, List<Comment> comments) {}
