package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BugStatus implements WireValue {
    OPEN("Open"),
    IN_PROGRESS("In Progress"),
    RESOLVED("Resolved"),
    CLOSED("Closed");

    private final String wireValue;

    BugStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }

    @JsonCreator
    public static BugStatus fromWire(String value) {
        return WireValue.parse(BugStatus.class, value, "status");
    }
}
