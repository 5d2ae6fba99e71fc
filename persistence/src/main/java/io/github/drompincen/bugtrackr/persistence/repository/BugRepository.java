package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.persistence.codec.BugCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bugs, newest first. Each guarded write changes its attributes and {@code updatedAt} in
 * one store call.
 */
@Repository
public class BugRepository extends CollectionRepository<Bug> {

    private static final Comparator<Bug> NEWEST_FIRST =
            Comparator.comparing(Bug::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    public BugRepository(DocumentStoreClient store, BugCodec codec, StoreSettings settings) {
        super(store, codec, settings);
    }

    @Override
    protected Comparator<Bug> defaultOrder() {
        return NEWEST_FIRST;
    }

    public List<Bug> findAll(BugFilter filter) {
        return findAll(filter.toPredicate());
    }

    public Bug updateStatus(String id, BugStatus status, Instant updatedAt) {
        return updateFields(id, stamped(BugCodec.STATUS, status, updatedAt));
    }

    public Bug updateValidation(String id, boolean validated, Instant updatedAt) {
        return updateFields(id, stamped(BugCodec.VALIDATED, validated, updatedAt));
    }

    /** {@code assignedTo} may be null to clear the assignment. */
    public Bug updateAssignment(String id, String assignedTo, Instant updatedAt) {
        return updateFields(id, stamped(BugCodec.ASSIGNED_TO, assignedTo, updatedAt));
    }

    /** Bumps only the last-modified time. */
    public Bug touch(String id, Instant updatedAt) {
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(BugCodec.UPDATED_AT, updatedAt);
        return updateFields(id, updates);
    }

    private static Map<String, Object> stamped(String field, Object value, Instant updatedAt) {
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(field, value);
        updates.put(BugCodec.UPDATED_AT, updatedAt);
        return updates;
    }
}
