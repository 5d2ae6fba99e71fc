package io.github.drompincen.bugtrackr.persistence.codec;

import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.ActivityLog;
import io.github.drompincen.bugtrackr.protocol.api.EntityKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/** Audit entries are append-only; no attribute is updatable. */
@Component
public class ActivityLogCodec extends NativeFieldCodec<ActivityLog> {

    public static final String BUG_ID = "bugId";
    public static final String ACTION = "action";
    public static final String PERFORMED_BY = "performedBy";
    public static final String TIMESTAMP = "timestamp";

    @Override
    public EntityKind kind() {
        return EntityKind.ACTIVITY_LOG;
    }

    @Override
    public Map<String, Object> encode(ActivityLog entry) {
        Map<String, Object> fields = typed();
        fields.put(BUG_ID, entry.bugId());
        fields.put(ACTION, entry.action());
        fields.put(PERFORMED_BY, entry.performedBy());
        fields.put(TIMESTAMP, ItemFields.storedValue(entry.timestamp()));
        return fields;
    }

    @Override
    public ActivityLog decode(StoredItem item) {
        String bugId = ItemFields.text(item, BUG_ID);
        String action = ItemFields.text(item, ACTION);
        String performedBy = ItemFields.text(item, PERFORMED_BY);
        Instant timestamp = ItemFields.timestamp(item, TIMESTAMP);
        String id = item.identity().orElse(null);
        return ItemFields.build(item, () -> new ActivityLog(id, bugId, action, performedBy, timestamp));
    }

    @Override
    protected Set<String> updatableFields() {
        return Set.of();
    }
}
