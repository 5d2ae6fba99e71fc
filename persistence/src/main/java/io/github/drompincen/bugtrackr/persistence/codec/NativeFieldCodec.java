package io.github.drompincen.bugtrackr.persistence.codec;

import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Encoding where every attribute is its own stored field and the discriminator sits in
 * {@value EntityCodec#TYPE_FIELD}.
 */
abstract class NativeFieldCodec<T> implements EntityCodec<T> {

    /** Attributes a partial update may touch. */
    protected abstract Set<String> updatableFields();

    /** Hook to check or coerce one update value; the default only converts to stored form. */
    protected Object updateValue(String field, Object value) {
        return ItemFields.storedValue(value);
    }

    @Override
    public Optional<String> discriminatorOf(StoredItem item) {
        Object type = item.get(TYPE_FIELD);
        return type instanceof String tag ? Optional.of(tag) : Optional.empty();
    }

    @Override
    public Map<String, Object> encodeUpdates(Map<String, Object> updates, Supplier<StoredItem> current) {
        Map<String, Object> stored = new LinkedHashMap<>();
        updates.forEach((field, value) -> {
            if (!updatableFields().contains(field)) {
                throw new ValidationException("Field '" + field + "' cannot be updated on a " + kind().label());
            }
            stored.put(field, updateValue(field, value));
        });
        return stored;
    }

    protected Map<String, Object> typed() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TYPE_FIELD, kind().discriminator());
        return fields;
    }

    static String requireUpdateText(String field, Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ValidationException(field + " cannot be empty");
        }
        return text;
    }
}
