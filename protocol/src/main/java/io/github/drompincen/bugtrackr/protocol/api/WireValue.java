package io.github.drompincen.bugtrackr.protocol.api;

import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/** An enumeration whose stored and JSON form differs from its constant name. */
public interface WireValue {

    String wireValue();

    /**
     * Resolves {@code value} against the wire values (exact) or constant names of
     * {@code type}.
     */
    static <E extends Enum<E> & WireValue> E parse(Class<E> type, String value, String fieldName) {
        if (value != null) {
            for (E constant : type.getEnumConstants()) {
                if (constant.wireValue().equals(value) || constant.name().equals(value)) {
                    return constant;
                }
            }
        }
        String valid = Arrays.stream(type.getEnumConstants())
                .map(WireValue::wireValue)
                .collect(Collectors.joining(", "));
        throw new ValidationException("Invalid " + fieldName + " '" + value + "'. Must be one of: " + valid);
    }
}
