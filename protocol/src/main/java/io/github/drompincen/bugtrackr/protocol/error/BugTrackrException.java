package io.github.drompincen.bugtrackr.protocol.error;

/**
 * Root of the bug tracker's failure taxonomy. Callers branch on the concrete subtype,
 * never on the message text.
 */
public abstract class BugTrackrException extends RuntimeException {

    protected BugTrackrException(String message) {
        super(message);
    }

    protected BugTrackrException(String message, Throwable cause) {
        super(message, cause);
    }
}
