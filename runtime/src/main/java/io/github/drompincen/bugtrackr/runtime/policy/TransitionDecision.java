package io.github.drompincen.bugtrackr.runtime.policy;

import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import io.github.drompincen.bugtrackr.protocol.error.DenialReason;
import io.github.drompincen.bugtrackr.protocol.error.TransitionDeniedException;

/**
 * Outcome of a policy check. When allowed, {@code nextState} is the status to write and
 * {@code reason} is null; when denied, {@code message} explains why.
 */
public record TransitionDecision(boolean allowed, BugStatus nextState, DenialReason reason, String message) {

    public static TransitionDecision allow(BugStatus nextState) {
        return new TransitionDecision(true, nextState, null, null);
    }

    /** Allowed action that leaves the status where it is. */
    public static TransitionDecision permit() {
        return new TransitionDecision(true, null, null, null);
    }

    public static TransitionDecision deny(DenialReason reason, String message) {
        return new TransitionDecision(false, null, reason, message);
    }

    /** The next state (null for {@link #permit()}), or the denial as an exception. */
    public BugStatus orThrow() {
        if (!allowed) {
            throw new TransitionDeniedException(reason, message);
        }
        return nextState;
    }
}
