package io.github.drompincen.bugtrackr.protocol.error;

/** A write or a required lookup targeted an item that does not exist. */
public class NotFoundException extends BugTrackrException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        this(kind, "ID", id);
    }

    /** Lookup by an attribute other than the identifier, e.g. a user by email. */
    public NotFoundException(String kind, String attribute, String value) {
        super(capitalize(kind) + " with " + attribute + " " + value + " not found");
        this.kind = kind;
        this.id = value;
    }

    public String getKind() { return kind; }
    public String getId() { return id; }

    private static String capitalize(String kind) {
        if (kind == null || kind.isEmpty()) return "Item";
        return Character.toUpperCase(kind.charAt(0)) + kind.substring(1);
    }
}
