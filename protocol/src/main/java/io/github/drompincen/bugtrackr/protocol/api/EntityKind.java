package io.github.drompincen.bugtrackr.protocol.api;

/**
 * Discriminator tag for every entity kind that can share one physical collection.
 */
public enum EntityKind {
    BUG("bug"),
    COMMENT("comment"),
    ACTIVITY_LOG("activity_log"),
    PROJECT("project"),
    USER("user");

    private final String discriminator;

    EntityKind(String discriminator) {
        this.discriminator = discriminator;
    }

    public String discriminator() { return discriminator; }

    /** Human-readable name used in messages, e.g. "activity log". */
    public String label() {
        return discriminator.replace('_', ' ');
    }
}
