package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.persistence.codec.EntityCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.error.MalformedDataException;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.protocol.error.RemoteStoreException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Typed view of one entity kind inside a collection shared with other kinds. Reads pull
 * the whole collection, keep the items carrying this kind's discriminator, then filter
 * and sort in memory. Items that fail to decode are logged and skipped.
 *
 * @param <T> the domain record
 */
public abstract class CollectionRepository<T> {

    private static final Logger log = LoggerFactory.getLogger(CollectionRepository.class);

    protected final DocumentStoreClient store;
    protected final EntityCodec<T> codec;
    private final String collection;

    protected CollectionRepository(DocumentStoreClient store, EntityCodec<T> codec, StoreSettings settings) {
        this.store = store;
        this.codec = codec;
        this.collection = settings.collection();
    }

    /** Order of {@link #findAll} results. */
    protected abstract Comparator<T> defaultOrder();

    public T create(T entity) {
        Map<String, Object> fields = codec.encode(entity);
        StoredItem created = StoredItem.of(fields).overlay(store.create(collection, fields));
        if (created.identity().isEmpty()) {
            throw new RemoteStoreException("create",
                    "Document store returned no identifier for the new " + label(), null);
        }
        log.info("Created {} '{}'", label(), created.describeId());
        return codec.decode(created);
    }

    /**
     * Empty when the item does not exist or belongs to another kind.
     *
     * @throws MalformedDataException if the item is this kind but cannot be decoded
     */
    public Optional<T> findById(String id) {
        requireId(id);
        Optional<StoredItem> item = store.getById(collection, id);
        if (item.isPresent() && !codec.accepts(item.get())) {
            log.debug("Item '{}' is not a {}", id, label());
            return Optional.empty();
        }
        return item.map(codec::decode);
    }

    public T get(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException(label(), id));
    }

    public List<T> findAll() {
        return findAll(entity -> true);
    }

    public List<T> findAll(Predicate<? super T> filter) {
        List<T> matches = new ArrayList<>();
        int skipped = 0;
        for (StoredItem item : store.getAll(collection)) {
            try {
                if (!codec.accepts(item)) {
                    continue;
                }
                T entity = codec.decode(item);
                if (filter.test(entity)) {
                    matches.add(entity);
                }
            } catch (MalformedDataException e) {
                skipped++;
                log.warn("Skipping {} item '{}': {}", label(), item.describeId(), e.getMessage());
            }
        }
        matches.sort(defaultOrder());
        if (skipped > 0) {
            log.warn("Skipped {} malformed item(s) while listing {}s", skipped, label());
        }
        log.debug("Found {} {}(s)", matches.size(), label());
        return matches;
    }

    /**
     * Writes the given attributes in a single store call and returns the updated entity.
     *
     * @param updates domain attribute names to new values
     * @throws NotFoundException if the item does not exist
     */
    public T updateFields(String id, Map<String, Object> updates) {
        requireId(id);
        if (updates == null || updates.isEmpty()) {
            throw new ValidationException("updates cannot be empty");
        }
        Map<String, Object> stored = codec.encodeUpdates(updates, () -> store.getById(collection, id)
                .filter(codec::accepts)
                .orElseThrow(() -> new NotFoundException(label(), id)));
        StoredItem updated = store.update(collection, id, stored);
        if (updated.identity().isEmpty()) {
            updated = updated.overlay(StoredItem.of(Map.of(StoredItem.AUTO_ID_KEY, id)));
        }
        log.info("Updated {} '{}' fields {}", label(), id, stored.keySet());
        return codec.decode(updated);
    }

    public boolean delete(String id) {
        requireId(id);
        boolean deleted = store.delete(collection, id);
        log.info("Delete {} '{}': {}", label(), id, deleted ? "removed" : "not found");
        return deleted;
    }

    public String collection() {
        return collection;
    }

    protected String label() {
        return codec.kind().label();
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("id cannot be empty");
        }
    }
}
