package io.github.drompincen.bugtrackr.persistence.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Raw item as held by the document store: an untyped field map. The store assigns the
 * identifier under {@link #AUTO_ID_KEY}; callers may also carry an explicit {@code _id}
 * or {@code id}.
 */
public record StoredItem(Map<String, Object> fields) {

    public static final String AUTO_ID_KEY = "__auto_id__";
    public static final String ID_KEY = "_id";
    public static final String PLAIN_ID_KEY = "id";

    public StoredItem {
        fields = Collections.unmodifiableMap(fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>());
    }

    public static StoredItem of(Map<String, ?> fields) {
        return new StoredItem(fields != null ? new LinkedHashMap<>(fields) : null);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    public Optional<String> autoId() {
        Object value = fields.get(AUTO_ID_KEY);
        return value != null ? Optional.of(value.toString()) : Optional.empty();
    }

    /** Explicit identifier if present, otherwise the auto-assigned one. */
    public Optional<String> identity() {
        for (String key : new String[] {ID_KEY, PLAIN_ID_KEY}) {
            Object value = fields.get(key);
            if (value != null && !value.toString().isBlank()) {
                return Optional.of(value.toString());
            }
        }
        return autoId();
    }

    /** Identifier for log and error messages. */
    public String describeId() {
        return identity().orElse("<unassigned>");
    }

    /** This item's fields overlaid with {@code other}'s; {@code other} wins on conflicts. */
    public StoredItem overlay(StoredItem other) {
        Map<String, Object> merged = new LinkedHashMap<>(fields);
        other.fields().forEach((key, value) -> {
            if (value != null) merged.put(key, value);
        });
        return new StoredItem(merged);
    }
}
