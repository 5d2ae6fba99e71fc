package io.github.drompincen.bugtrackr.protocol.error;

/**
 * A stored item could not be decoded: wrong runtime type for a field, unparsable
 * overflow payload, or a missing required attribute.
 */
public class MalformedDataException extends BugTrackrException {

    private final String itemId;
    private final String field;

    public MalformedDataException(String itemId, String field, String message) {
        this(itemId, field, message, null);
    }

    public MalformedDataException(String itemId, String field, String message, Throwable cause) {
        super("Malformed item '" + itemId + "'" + (field != null ? " field '" + field + "'" : "")
                + ": " + message, cause);
        this.itemId = itemId;
        this.field = field;
    }

    public String getItemId() { return itemId; }

    /** Offending field, or null when the item as a whole is unusable. */
    public String getField() { return field; }
}
