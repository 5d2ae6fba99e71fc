package io.github.drompincen.bugtrackr.persistence.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.EntityKind;
import io.github.drompincen.bugtrackr.protocol.api.User;
import io.github.drompincen.bugtrackr.protocol.api.UserRole;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Component
public class UserCodec extends OverflowPayloadCodec<User> {

    public static final String EMAIL = "email";
    public static final String ROLE = "role";

    public UserCodec(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.USER;
    }

    @Override
    protected String nameOf(User user) {
        return user.name();
    }

    @Override
    protected Instant createdAtOf(User user) {
        return user.createdAt();
    }

    @Override
    protected Map<String, Object> payloadOf(User user) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EMAIL, user.email());
        payload.put(ROLE, user.role());
        return payload;
    }

    @Override
    protected User assemble(StoredItem item, String id, String name, Map<String, Object> payload,
                            Instant createdAt) {
        String email = OverflowPayload.requiredAttribute(item, payload, EMAIL);
        String role = OverflowPayload.requiredAttribute(item, payload, ROLE);
        return new User(id, name, email, role, createdAt);
    }

    @Override
    protected Set<String> payloadAttributes() {
        return Set.of(EMAIL, ROLE);
    }

    @Override
    protected Object payloadValue(String attribute, Object value) {
        if (ROLE.equals(attribute)) {
            return value instanceof UserRole role ? role.wireValue() : UserRole.fromWire(String.valueOf(value)).wireValue();
        }
        return super.payloadValue(attribute, value);
    }
}
