package io.github.drompincen.bugtrackr.protocol.error;

public enum DenialReason {
    /** The acting role may not perform this change at all. */
    INSUFFICIENT_ROLE,
    /** The role is allowed but the entity is not in a state that permits the change. */
    PRECONDITION_NOT_MET
}
