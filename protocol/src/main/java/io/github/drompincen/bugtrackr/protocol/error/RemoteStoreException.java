package io.github.drompincen.bugtrackr.protocol.error;

import java.util.OptionalInt;

/**
 * Transport failure or non-success response from the document store, other than
 * "not found". The adapter does not retry; retry policy belongs to the caller.
 */
public class RemoteStoreException extends BugTrackrException {

    private final String operation;
    private final Integer httpStatus;

    public RemoteStoreException(String operation, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.httpStatus = httpStatus;
    }

    public RemoteStoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.httpStatus = null;
    }

    public String getOperation() { return operation; }

    /** HTTP status of the failed call, empty for transport-level failures. */
    public OptionalInt getHttpStatus() {
        return httpStatus != null ? OptionalInt.of(httpStatus) : OptionalInt.empty();
    }
}
