package io.github.drompincen.bugtrackr.persistence.codec;

import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.BugPriority;
import io.github.drompincen.bugtrackr.protocol.api.BugSeverity;
import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import io.github.drompincen.bugtrackr.protocol.api.EntityKind;
import io.github.drompincen.bugtrackr.protocol.api.WireValue;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class BugCodec extends NativeFieldCodec<Bug> {

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String PROJECT_ID = "projectId";
    public static final String REPORTED_BY = "reportedBy";
    public static final String ASSIGNED_TO = "assignedTo";
    public static final String STATUS = "status";
    public static final String PRIORITY = "priority";
    public static final String SEVERITY = "severity";
    public static final String TAGS = "tags";
    public static final String VALIDATED = "validated";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    private static final Set<String> UPDATABLE = Set.of(TITLE, DESCRIPTION, ASSIGNED_TO, STATUS, PRIORITY,
            SEVERITY, TAGS, VALIDATED, UPDATED_AT);

    @Override
    public EntityKind kind() {
        return EntityKind.BUG;
    }

    @Override
    public Map<String, Object> encode(Bug bug) {
        Map<String, Object> fields = typed();
        fields.put(TITLE, bug.title());
        fields.put(DESCRIPTION, bug.description());
        fields.put(STATUS, bug.status().wireValue());
        fields.put(PRIORITY, bug.priority().wireValue());
        fields.put(SEVERITY, bug.severity().wireValue());
        fields.put(PROJECT_ID, bug.projectId());
        fields.put(REPORTED_BY, bug.reportedBy());
        fields.put(ASSIGNED_TO, bug.assignedTo());
        fields.put(TAGS, bug.tags());
        fields.put(VALIDATED, bug.validated());
        fields.put(CREATED_AT, ItemFields.storedValue(bug.createdAt()));
        fields.put(UPDATED_AT, ItemFields.storedValue(bug.updatedAt()));
        return fields;
    }

    @Override
    public Bug decode(StoredItem item) {
        String title = ItemFields.text(item, TITLE);
        String description = ItemFields.text(item, DESCRIPTION);
        String projectId = ItemFields.text(item, PROJECT_ID);
        String reportedBy = ItemFields.text(item, REPORTED_BY);
        String assignedTo = ItemFields.text(item, ASSIGNED_TO);
        BugStatus status = ItemFields.enumValue(item, STATUS, BugStatus.class);
        BugPriority priority = ItemFields.enumValue(item, PRIORITY, BugPriority.class);
        BugSeverity severity = ItemFields.enumValue(item, SEVERITY, BugSeverity.class);
        List<String> tags = ItemFields.stringList(item, TAGS);
        boolean validated = ItemFields.flag(item, VALIDATED);
        Instant createdAt = ItemFields.timestamp(item, CREATED_AT);
        Instant updatedAt = ItemFields.timestamp(item, UPDATED_AT);
        String id = item.identity().orElse(null);
        return ItemFields.build(item, () -> new Bug(id, title, description, projectId, reportedBy, assignedTo,
                status, priority, severity, tags, validated, createdAt, updatedAt));
    }

    @Override
    protected Set<String> updatableFields() {
        return UPDATABLE;
    }

    @Override
    protected Object updateValue(String field, Object value) {
        switch (field) {
            case STATUS:
                return wire(BugStatus.class, field, value);
            case PRIORITY:
                return wire(BugPriority.class, field, value);
            case SEVERITY:
                return wire(BugSeverity.class, field, value);
            case TITLE:
                String title = requireUpdateText(field, value);
                if (title.length() > Bug.MAX_TITLE_LENGTH) {
                    throw new ValidationException("title must be at most " + Bug.MAX_TITLE_LENGTH + " characters");
                }
                return title;
            case DESCRIPTION:
                return requireUpdateText(field, value);
            case VALIDATED:
                if (!(value instanceof Boolean)) {
                    throw new ValidationException("validated must be true or false");
                }
                return value;
            case TAGS:
                if (value != null && !(value instanceof Collection<?>)) {
                    throw new ValidationException("tags must be a list");
                }
                return value != null ? ItemFields.storedValue(value) : List.of();
            case UPDATED_AT:
                if (!(value instanceof Instant)) {
                    throw new ValidationException("updatedAt must be a timestamp");
                }
                return ItemFields.storedValue(value);
            default:
                return ItemFields.storedValue(value);
        }
    }

    private static <E extends Enum<E> & WireValue> String wire(Class<E> type, String field, Object value) {
        if (type.isInstance(value)) {
            return type.cast(value).wireValue();
        }
        if (value instanceof String text) {
            return WireValue.parse(type, text, field).wireValue();
        }
        throw new ValidationException(field + " is required");
    }
}
