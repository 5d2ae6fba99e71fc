package io.github.drompincen.bugtrackr.persistence.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.Project;
import io.github.drompincen.bugtrackr.protocol.api.User;
import io.github.drompincen.bugtrackr.protocol.error.MalformedDataException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverflowPayloadCodecTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T09:30:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProjectCodec projects = new ProjectCodec(objectMapper);
    private final UserCodec users = new UserCodec(objectMapper);

    private static StoredItem project(String description) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("__auto_id__", "p1");
        fields.put("name", "Checkout");
        fields.put("description", description);
        fields.put("created_at", "2024-03-01 09:30:00");
        return StoredItem.of(fields);
    }

    @Test
    void projectPayloadCarriesDiscriminatorAndOverflowAttributes() throws Exception {
        Map<String, Object> fields = projects.encode(new Project(null, "Checkout", "Payment flow", "u1", CREATED));

        assertThat(fields).containsEntry("name", "Checkout")
                .containsEntry("created_at", "2024-03-01 09:30:00")
                .doesNotContainKey("type");
        Map<String, Object> payload = objectMapper.readValue((String) fields.get("description"), Map.class);
        assertThat(payload).containsEntry("type", "project")
                .containsEntry("description", "Payment flow")
                .containsEntry("createdBy", "u1");
    }

    @Test
    void decodesProjectFromPayload() {
        Project project = projects.decode(project("{\"type\":\"project\",\"description\":\"Payment flow\",\"createdBy\":\"u1\"}"));

        assertThat(project).isEqualTo(new Project("p1", "Checkout", "Payment flow", "u1", CREATED));
    }

    @Test
    void discriminatorComesFromPayloadUnlessNativeTypeExists() {
        assertThat(projects.discriminatorOf(project("{\"type\":\"project\"}"))).contains("project");
        assertThat(projects.discriminatorOf(project("{\"type\":\"user\"}"))).contains("user");
        assertThat(projects.discriminatorOf(project("plain text"))).isEmpty();
        assertThat(projects.discriminatorOf(StoredItem.of(Map.of("type", "bug", "description", "{broken"))))
                .contains("bug");
        assertThat(users.accepts(project("{\"type\":\"project\"}"))).isFalse();
    }

    @Test
    void unparsablePayloadIsMalformed() {
        assertThatThrownBy(() -> projects.discriminatorOf(project("{not json")))
                .isInstanceOfSatisfying(MalformedDataException.class,
                        e -> assertThat(e.getField()).isEqualTo("description"));
    }

    @Test
    void missingPayloadAttributeIsMalformed() {
        assertThatThrownBy(() -> projects.decode(project("{\"type\":\"project\",\"description\":\"x\"}")))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("createdBy");
    }

    @Test
    void payloadUpdateMergesIntoCurrentPayload() throws Exception {
        StoredItem current = project("{\"type\":\"project\",\"description\":\"Old\",\"createdBy\":\"u1\"}");

        Map<String, Object> stored = projects.encodeUpdates(Map.of("description", "New"), () -> current);

        Map<String, Object> payload = objectMapper.readValue((String) stored.get("description"), Map.class);
        assertThat(payload).containsEntry("type", "project")
                .containsEntry("description", "New")
                .containsEntry("createdBy", "u1");
    }

    @Test
    void nameUpdateDoesNotReadCurrentItem() {
        Map<String, Object> stored = projects.encodeUpdates(Map.of("name", "Renamed"), () -> {
            throw new AssertionError("name is a native field");
        });

        assertThat(stored).containsOnly(Map.entry("name", "Renamed"));
    }

    @Test
    void rejectsUnknownUpdateAttribute() {
        assertThatThrownBy(() -> projects.encodeUpdates(Map.of("created_at", "2020-01-01 00:00:00"), () -> null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void userRoleIsNormalizedOnUpdateAndDecodedVerbatim() {
        StoredItem current = StoredItem.of(Map.of("__auto_id__", "u1", "name", "Dana",
                "description", "{\"type\":\"user\",\"email\":\"dana@example.com\",\"role\":\"tester\"}",
                "created_at", "2024-03-01 09:30:00"));

        Map<String, Object> stored = users.encodeUpdates(Map.of("role", " Admin "), () -> current);
        User user = users.decode(current);

        assertThat((String) stored.get("description")).contains("\"role\":\"admin\"");
        assertThat(user.role()).isEqualTo("tester");
        assertThat(user.email()).isEqualTo("dana@example.com");
        assertThatThrownBy(() -> users.encodeUpdates(Map.of("role", "manager"), () -> current))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void projectWithSubSecondCreationTimeSurvivesEncodeThenDecode() {
        Project project = new Project("p5", "Checkout", "Payment flow", "u1",
                Instant.parse("2024-03-01T09:30:00.123456789Z"));
        Map<String, Object> fields = new LinkedHashMap<>(projects.encode(project));
        fields.put("__auto_id__", "p5");

        assertThat(fields.get("created_at")).isEqualTo("2024-03-01 09:30:00.123456789");
        assertThat(projects.decode(StoredItem.of(fields))).isEqualTo(project);
    }

    @Test
    void userWithSubSecondCreationTimeSurvivesEncodeThenDecode() {
        User user = new User("u5", "Tess", "tess@example.com", "tester",
                Instant.parse("2024-03-01T09:30:00.250Z"));
        Map<String, Object> fields = new LinkedHashMap<>(users.encode(user));
        fields.put("__auto_id__", "u5");

        assertThat(users.decode(StoredItem.of(fields))).isEqualTo(user);
    }
}
