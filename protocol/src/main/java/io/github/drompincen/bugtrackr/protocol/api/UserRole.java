package io.github.drompincen.bugtrackr.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

import java.util.Locale;

/**
 * Roles recognised by the status workflow. {@link #ADMIN} is the elevated role,
 * {@link #TESTER} the validating role.
 */
public enum UserRole implements WireValue {
    ADMIN("admin"),
    TESTER("tester"),
    DEVELOPER("developer");

    private final String wireValue;

    UserRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Override
    public String wireValue() { return wireValue; }

    public boolean isElevated() {
        return this == ADMIN;
    }

    /** Whether this role may mark a bug validated or move it into Closed. */
    public boolean canValidate() {
        return this == ADMIN || this == TESTER;
    }

    @JsonCreator
    public static UserRole fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("role cannot be empty");
        }
        return WireValue.parse(UserRole.class, value.trim().toLowerCase(Locale.ROOT), "role");
    }
}
