package io.github.drompincen.bugtrackr.persistence.codec;

import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.EntityKind;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bidirectional mapping between one entity kind and its stored field layout.
 *
 * @param <T> the domain record
 */
public interface EntityCodec<T> {

    String TYPE_FIELD = "type";

    EntityKind kind();

    /** Stored fields for a new item, discriminator included, identifier excluded. */
    Map<String, Object> encode(T entity);

    /**
     * Decodes an item already known to carry this kind's discriminator.
     *
     * @throws io.github.drompincen.bugtrackr.protocol.error.MalformedDataException if a
     *         field has the wrong type or a required attribute is missing
     */
    T decode(StoredItem item);

    /** The discriminator the item carries, wherever this encoding keeps it. */
    Optional<String> discriminatorOf(StoredItem item);

    /**
     * Translates a partial update keyed by domain attribute names into stored field
     * updates. {@code current} is consulted only when the encoding has to merge into an
     * existing value.
     *
     * @throws io.github.drompincen.bugtrackr.protocol.error.ValidationException for an
     *         unknown or read-only attribute, or an invalid value
     */
    Map<String, Object> encodeUpdates(Map<String, Object> updates, Supplier<StoredItem> current);

    default boolean accepts(StoredItem item) {
        return discriminatorOf(item).map(kind().discriminator()::equals).orElse(false);
    }
}
