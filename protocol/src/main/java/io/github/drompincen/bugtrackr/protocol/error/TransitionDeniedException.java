package io.github.drompincen.bugtrackr.protocol.error;

public class TransitionDeniedException extends BugTrackrException {

    private final DenialReason reason;

    public TransitionDeniedException(DenialReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DenialReason getReason() { return reason; }
}
