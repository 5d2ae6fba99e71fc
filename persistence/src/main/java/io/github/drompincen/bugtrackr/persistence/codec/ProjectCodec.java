package io.github.drompincen.bugtrackr.persistence.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.EntityKind;
import io.github.drompincen.bugtrackr.protocol.api.Project;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Projects keep their own description and creator inside the overflow payload:
 * {@code {"type": "project", "description": ..., "createdBy": ...}}.
 */
@Component
public class ProjectCodec extends OverflowPayloadCodec<Project> {

    public static final String DESCRIPTION = "description";
    public static final String CREATED_BY = "createdBy";

    public ProjectCodec(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.PROJECT;
    }

    @Override
    protected String nameOf(Project project) {
        return project.name();
    }

    @Override
    protected Instant createdAtOf(Project project) {
        return project.createdAt();
    }

    @Override
    protected Map<String, Object> payloadOf(Project project) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(DESCRIPTION, project.description());
        payload.put(CREATED_BY, project.createdBy());
        return payload;
    }

    @Override
    protected Project assemble(StoredItem item, String id, String name, Map<String, Object> payload,
                               Instant createdAt) {
        String description = OverflowPayload.requiredAttribute(item, payload, DESCRIPTION);
        String createdBy = OverflowPayload.requiredAttribute(item, payload, CREATED_BY);
        return new Project(id, name, description, createdBy, createdAt);
    }

    @Override
    protected Set<String> payloadAttributes() {
        return Set.of(DESCRIPTION, CREATED_BY);
    }
}
