package io.github.drompincen.bugtrackr.persistence.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.protocol.error.RemoteStoreException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpDocumentStoreClientTest {

    private static final String BASE = "https://store.example.test/api/v1";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private HttpDocumentStoreClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpDocumentStoreClient(restTemplate, new ObjectMapper(),
                new StoreSettings(BASE + "/", "secret-key", null, ""));
    }

    @Test
    void createWrapsFieldsAndReturnsAssignedId() {
        server.expect(requestTo(BASE))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret-key"))
                .andExpect(jsonPath("$.collection_item.type").value("bug"))
                .andExpect(jsonPath("$.collection_item.title").value("Crash on save"))
                .andRespond(withSuccess("{\"__auto_id__\":\"b1\",\"type\":\"bug\",\"title\":\"Crash on save\"}",
                        MediaType.APPLICATION_JSON));

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "bug");
        fields.put("title", "Crash on save");
        StoredItem created = client.create("", fields);

        assertThat(created.autoId()).contains("b1");
        assertThat(created.get("title")).isEqualTo("Crash on save");
        server.verify();
    }

    @Test
    void createRejectsEmptyFieldsWithoutCallingStore() {
        assertThatThrownBy(() -> client.create("", Map.of()))
                .isInstanceOf(ValidationException.class);
        server.verify();
    }

    @Test
    void createOnMissingCollectionIsRemoteFailure() {
        server.expect(requestTo(BASE)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.create("", Map.of("type", "bug")))
                .isInstanceOf(RemoteStoreException.class);
    }

    @Test
    void getAllAcceptsPlainList() {
        server.expect(requestTo(BASE)).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[{\"__auto_id__\":\"1\",\"type\":\"bug\"},{\"__auto_id__\":\"2\",\"type\":\"comment\"}]",
                        MediaType.APPLICATION_JSON));

        List<StoredItem> items = client.getAll("");

        assertThat(items).extracting(item -> item.get("type")).containsExactly("bug", "comment");
    }

    @Test
    void getAllUnwrapsItemsObject() {
        server.expect(requestTo(BASE))
                .andRespond(withSuccess("{\"items\":[{\"__auto_id__\":\"1\",\"type\":\"bug\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.getAll("")).hasSize(1);
    }

    @Test
    void getAllFlattensListsOfPayloadEnvelopes() {
        server.expect(requestTo(BASE))
                .andRespond(withSuccess("{\"bugs\":[{\"__auto_id__\":\"1\",\"payload\":{\"type\":\"bug\",\"title\":\"A\"}}],"
                                + "\"other\":[{\"__auto_id__\":\"2\",\"type\":\"comment\"}]}",
                        MediaType.APPLICATION_JSON));

        List<StoredItem> items = client.getAll("");

        assertThat(items).hasSize(2);
        assertThat(items.get(0).autoId()).contains("1");
        assertThat(items.get(0).get("title")).isEqualTo("A");
        assertThat(items.get(1).get("type")).isEqualTo("comment");
    }

    @Test
    void getAllTreatsSingleObjectAsOneItem() {
        server.expect(requestTo(BASE))
                .andRespond(withSuccess("{\"__auto_id__\":\"9\",\"type\":\"project\"}", MediaType.APPLICATION_JSON));

        assertThat(client.getAll("")).singleElement()
                .satisfies(item -> assertThat(item.autoId()).contains("9"));
    }

    @Test
    void getAllReturnsEmptyForMissingOrEmptyCollection() {
        server.expect(requestTo(BASE)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(client.getAll("")).isEmpty();
        assertThat(client.getAll("")).isEmpty();
    }

    @Test
    void getAllWithOnlyEmptyKeyedListsIsEmpty() {
        server.expect(requestTo(BASE))
                .andRespond(withSuccess("{\"def-1\":[],\"def-2\":[]}", MediaType.APPLICATION_JSON));

        assertThat(client.getAll("")).isEmpty();
    }

    @Test
    void getByIdUsesNamedCollectionPath() {
        HttpDocumentStoreClient named = new HttpDocumentStoreClient(restTemplate, new ObjectMapper(),
                new StoreSettings(BASE, "secret-key", null, "tracker"));
        server.expect(requestTo(BASE + "/tracker/b1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"__auto_id__\":\"b1\",\"type\":\"bug\"}", MediaType.APPLICATION_JSON));

        Optional<StoredItem> item = named.getById("tracker", "b1");

        assertThat(item).isPresent();
        assertThat(item.get().identity()).contains("b1");
    }

    @Test
    void getByIdReturnsEmptyOn404() {
        server.expect(requestTo(BASE + "/missing")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.getById("", "missing")).isEmpty();
    }

    @Test
    void getByIdRejectsBlankId() {
        assertThatThrownBy(() -> client.getById("", " ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void updateSendsPathValueList() {
        server.expect(requestTo(BASE + "/b1"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.id").value("b1"))
                .andExpect(jsonPath("$.fields[0].path").value("$.status"))
                .andExpect(jsonPath("$.fields[0].value").value("Closed"))
                .andExpect(jsonPath("$.fields[1].path").value("$.updatedAt"))
                .andRespond(withSuccess("{\"__auto_id__\":\"b1\",\"type\":\"bug\",\"status\":\"Closed\"}",
                        MediaType.APPLICATION_JSON));

        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("status", "Closed");
        updates.put("updatedAt", "2024-05-01T10:00:00Z");
        StoredItem updated = client.update("", "b1", updates);

        assertThat(updated.get("status")).isEqualTo("Closed");
        server.verify();
    }

    @Test
    void updateReadsBackWhenResponseIsEmpty() {
        server.expect(requestTo(BASE + "/b1")).andExpect(method(HttpMethod.PUT))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));
        server.expect(requestTo(BASE + "/b1")).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"__auto_id__\":\"b1\",\"status\":\"Open\"}", MediaType.APPLICATION_JSON));

        assertThat(client.update("", "b1", Map.of("status", "Open")).get("status")).isEqualTo("Open");
    }

    @Test
    void updateOfMissingItemIsNotFound() {
        server.expect(requestTo(BASE + "/gone")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.update("", "gone", Map.of("status", "Open")))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void updateRejectsEmptyUpdates() {
        assertThatThrownBy(() -> client.update("", "b1", Map.of()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void deleteReportsWhetherItemExisted() {
        server.expect(requestTo(BASE + "/c1")).andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));
        server.expect(requestTo(BASE + "/c2")).andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.delete("", "c1")).isTrue();
        assertThat(client.delete("", "c2")).isFalse();
    }

    @Test
    void serverErrorCarriesHttpStatus() {
        server.expect(requestTo(BASE)).andRespond(withServerError());

        assertThatThrownBy(() -> client.getAll(""))
                .isInstanceOfSatisfying(RemoteStoreException.class,
                        e -> assertThat(e.getHttpStatus()).hasValue(500));
    }

    @Test
    void transportFailureHasNoHttpStatus() {
        server.expect(requestTo(BASE)).andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.getAll(""))
                .isInstanceOfSatisfying(RemoteStoreException.class,
                        e -> assertThat(e.getHttpStatus()).isEmpty());
    }

    @Test
    void errorMessagesNeverContainCredential() {
        server.expect(requestTo(BASE)).andRespond(withServerError());

        assertThatThrownBy(() -> client.getAll(""))
                .isInstanceOf(RemoteStoreException.class)
                .hasMessageNotContaining("secret-key")
                .hasMessageNotContaining("store.example.test");
    }
}
