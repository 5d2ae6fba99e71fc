package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BugPriority implements WireValue {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String wireValue;

    BugPriority(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }

    @JsonCreator
    public static BugPriority fromWire(String value) {
        return WireValue.parse(BugPriority.class, value, "priority");
    }
}
