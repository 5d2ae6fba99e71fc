package io.github.drompincen.bugtrackr.protocol.api;

/** Result of a status change, validation or assignment. */
public record BugUpdateResponse(boolean success, String message, Bug bug) {

    public static BugUpdateResponse ok(String message, Bug bug) {
        return new BugUpdateResponse(true, message, bug);
    }
}
