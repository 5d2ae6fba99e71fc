package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.persistence.codec.ActivityLogCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.protocol.api.ActivityLog;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

/** Append-only audit trail, newest entry first. */
@Repository
public class ActivityLogRepository extends CollectionRepository<ActivityLog> {

    private static final Comparator<ActivityLog> NEWEST_FIRST =
            Comparator.comparing(ActivityLog::timestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    public ActivityLogRepository(DocumentStoreClient store, ActivityLogCodec codec, StoreSettings settings) {
        super(store, codec, settings);
    }

    @Override
    protected Comparator<ActivityLog> defaultOrder() {
        return NEWEST_FIRST;
    }

    public ActivityLog append(ActivityLog entry) {
        return create(entry);
    }

    public List<ActivityLog> findByBugId(String bugId) {
        return findAll(Filters.equalTo(ActivityLog::bugId, bugId));
    }
}
