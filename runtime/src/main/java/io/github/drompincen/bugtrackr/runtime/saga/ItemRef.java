package io.github.drompincen.bugtrackr.runtime.saga;

/** Where a written item lives; enough to find it again for manual cleanup. */
public record ItemRef(String collection, String id) {}
