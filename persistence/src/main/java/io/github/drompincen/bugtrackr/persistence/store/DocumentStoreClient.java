package io.github.drompincen.bugtrackr.persistence.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Create/read/update/delete over loosely-typed items in named collections. The store
 * offers no filtering, sorting or transactions. An empty collection name addresses the
 * base collection.
 *
 * <p>Failures: {@link io.github.drompincen.bugtrackr.protocol.error.ValidationException}
 * for bad arguments, {@link io.github.drompincen.bugtrackr.protocol.error.NotFoundException}
 * when an update targets a missing item, and
 * {@link io.github.drompincen.bugtrackr.protocol.error.RemoteStoreException} for anything
 * else the store rejects. Implementations do not retry.
 */
public interface DocumentStoreClient {

    StoredItem create(String collection, Map<String, Object> fields);

    /** Every item in the collection; empty when the collection does not exist. */
    List<StoredItem> getAll(String collection);

    /** The item, or empty when the store reports it missing. */
    Optional<StoredItem> getById(String collection, String id);

    StoredItem update(String collection, String id, Map<String, Object> fieldUpdates);

    /** {@code false} when there was nothing to delete. */
    boolean delete(String collection, String id);
}
