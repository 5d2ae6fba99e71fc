package io.github.drompincen.bugtrackr.persistence.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Encoding for kinds whose attributes do not fit the store's native fields. Only
 * {@code name} and {@code created_at} are stored natively; the discriminator and every
 * other attribute live in a JSON object held by the {@code description} field.
 */
abstract class OverflowPayloadCodec<T> implements EntityCodec<T> {

    public static final String NAME = "name";
    public static final String CREATED_AT = "created_at";

    static final int MAX_NAME_LENGTH = 200;

    protected final OverflowPayload payloads;

    protected OverflowPayloadCodec(ObjectMapper objectMapper) {
        this.payloads = new OverflowPayload(objectMapper);
    }

    protected abstract String nameOf(T entity);

    protected abstract Instant createdAtOf(T entity);

    /** Payload attributes of the entity, discriminator excluded. */
    protected abstract Map<String, Object> payloadOf(T entity);

    protected abstract T assemble(StoredItem item, String id, String name, Map<String, Object> payload,
                                  Instant createdAt);

    /** Payload attributes a partial update may touch. */
    protected abstract Set<String> payloadAttributes();

    /** Checks one payload update value and returns its stored form. */
    protected Object payloadValue(String attribute, Object value) {
        return NativeFieldCodec.requireUpdateText(attribute, value);
    }

    @Override
    public Map<String, Object> encode(T entity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE_FIELD, kind().discriminator());
        payload.putAll(payloadOf(entity));

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(NAME, nameOf(entity));
        fields.put(OverflowPayload.FIELD, payloads.write(payload));
        fields.put(CREATED_AT, ItemFields.legacyTimestamp(createdAtOf(entity)));
        return fields;
    }

    @Override
    public T decode(StoredItem item) {
        Map<String, Object> payload = payloads.read(item);
        String name = ItemFields.text(item, NAME);
        Instant createdAt = ItemFields.timestamp(item, CREATED_AT);
        String id = item.identity().orElse(null);
        return ItemFields.build(item, () -> assemble(item, id, name, payload, createdAt));
    }

    /**
     * A native {@code type} field wins; otherwise the payload's {@code type}. An item
     * whose description is not a JSON object has no discriminator.
     */
    @Override
    public Optional<String> discriminatorOf(StoredItem item) {
        if (item.get(TYPE_FIELD) instanceof String tag) {
            return Optional.of(tag);
        }
        if (!OverflowPayload.present(item)) {
            return Optional.empty();
        }
        Object tag = payloads.read(item).get(TYPE_FIELD);
        return tag instanceof String text ? Optional.of(text) : Optional.empty();
    }

    @Override
    public Map<String, Object> encodeUpdates(Map<String, Object> updates, Supplier<StoredItem> current) {
        Map<String, Object> stored = new LinkedHashMap<>();
        Map<String, Object> payloadUpdates = new LinkedHashMap<>();
        updates.forEach((attribute, value) -> {
            if (NAME.equals(attribute)) {
                String name = NativeFieldCodec.requireUpdateText(attribute, value);
                if (name.length() > MAX_NAME_LENGTH) {
                    throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
                }
                stored.put(NAME, name);
            } else if (payloadAttributes().contains(attribute)) {
                payloadUpdates.put(attribute, payloadValue(attribute, value));
            } else {
                throw new ValidationException("Field '" + attribute + "' cannot be updated on a " + kind().label());
            }
        });
        if (!payloadUpdates.isEmpty()) {
            Map<String, Object> merged = new LinkedHashMap<>(payloads.read(current.get()));
            merged.putAll(payloadUpdates);
            merged.put(TYPE_FIELD, kind().discriminator());
            stored.put(OverflowPayload.FIELD, payloads.write(merged));
        }
        return stored;
    }
}
