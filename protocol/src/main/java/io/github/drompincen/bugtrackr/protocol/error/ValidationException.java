package io.github.drompincen.bugtrackr.protocol.error;

/**
 * Caller-supplied arguments are malformed: empty id, empty update set, invalid
 * enumeration value, out-of-bounds text. Never retried.
 */
public class ValidationException extends BugTrackrException {

    public ValidationException(String message) {
        super(message);
    }
}
