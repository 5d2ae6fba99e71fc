package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BugSeverity implements WireValue {
    MINOR("Minor"),
    MAJOR("Major"),
    BLOCKER("Blocker");

    private final String wireValue;

    BugSeverity(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }

    @JsonCreator
    public static BugSeverity fromWire(String value) {
        return WireValue.parse(BugSeverity.class, value, "severity");
    }
}
