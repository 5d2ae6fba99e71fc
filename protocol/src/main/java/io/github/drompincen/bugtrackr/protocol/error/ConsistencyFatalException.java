package io.github.drompincen.bugtrackr.protocol.error;

/**
 * A multi-step write failed after its primary write and the compensating rollback failed
 * too. The record at {@code collection}/{@code itemId} is orphaned and needs manual repair.
 * The follow-up failure is the cause; the rollback failure is attached as suppressed.
 */
public class ConsistencyFatalException extends BugTrackrException {

    private final String operation;
    private final String collection;
    private final String itemId;

    public ConsistencyFatalException(String operation, String collection, String itemId, Throwable cause) {
        super("Inconsistent state after failed rollback of '" + operation + "': orphaned item '"
                + itemId + "' in collection '" + (collection == null || collection.isEmpty() ? "base" : collection)
                + "' requires manual cleanup", cause);
        this.operation = operation;
        this.collection = collection;
        this.itemId = itemId;
    }

    public String getOperation() { return operation; }
    public String getCollection() { return collection; }
    public String getItemId() { return itemId; }
}
