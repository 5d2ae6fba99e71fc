package io.github.drompincen.bugtrackr.persistence.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.protocol.error.RemoteStoreException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DocumentStoreClient} over the collection REST API.
 *
 * <pre>
 * POST   {base}/{collection}        body {"collection_item": {...}}
 * GET    {base}/{collection}
 * GET    {base}/{collection}/{id}
 * PUT    {base}/{collection}/{id}   body {"id": id, "fields": [{"path": "$.name", "value": v}]}
 * DELETE {base}/{collection}/{id}
 * </pre>
 *
 * The timeout lives on the supplied {@link RestTemplate}; the bearer credential is added
 * to every request here.
 */
public class HttpDocumentStoreClient implements DocumentStoreClient {

    private static final Logger log = LoggerFactory.getLogger(HttpDocumentStoreClient.class);

    static final String ITEM_WRAPPER_KEY = "collection_item";
    static final String ITEMS_KEY = "items";
    static final String PAYLOAD_KEY = "payload";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final StoreSettings settings;

    public HttpDocumentStoreClient(RestTemplate restTemplate, ObjectMapper objectMapper, StoreSettings settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = settings;
        log.info("Initialized document store client ({})", settings);
    }

    @Override
    public StoredItem create(String collection, Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new ValidationException("fields cannot be empty");
        }
        String label = StoreSettings.label(collection);
        log.info("Creating item in collection '{}'", label);

        JsonNode body = exchange(HttpMethod.POST, uri(collection), Map.of(ITEM_WRAPPER_KEY, fields), "create")
                .orElseThrow(() -> new RemoteStoreException("create", 404,
                        "Failed to create item: collection '" + label + "' not found", null));

        StoredItem created = toItem(unwrapSingle(body));
        log.info("Created item in collection '{}' with id '{}'", label, created.describeId());
        return created;
    }

    @Override
    public List<StoredItem> getAll(String collection) {
        String label = StoreSettings.label(collection);
        log.info("Retrieving all items from collection '{}'", label);

        Optional<JsonNode> body = exchange(HttpMethod.GET, uri(collection), null, "get all");
        if (body.isEmpty()) {
            log.warn("Collection '{}' not found or empty", label);
            return List.of();
        }
        List<StoredItem> items = flatten(body.get(), label);
        log.info("Retrieved {} items from collection '{}'", items.size(), label);
        return items;
    }

    @Override
    public Optional<StoredItem> getById(String collection, String id) {
        requireId(id);
        String label = StoreSettings.label(collection);

        Optional<JsonNode> body = exchange(HttpMethod.GET, uri(collection, id), null, "get");
        if (body.isEmpty() || isEmpty(body.get())) {
            log.warn("Item '{}' not found in collection '{}'", id, label);
            return Optional.empty();
        }
        return Optional.of(toItem(unwrapSingle(body.get())));
    }

    @Override
    public StoredItem update(String collection, String id, Map<String, Object> fieldUpdates) {
        requireId(id);
        if (fieldUpdates == null || fieldUpdates.isEmpty()) {
            throw new ValidationException("updates cannot be empty");
        }
        String label = StoreSettings.label(collection);

        List<Map<String, Object>> fields = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fieldUpdates.entrySet()) {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("path", "$." + entry.getKey());
            field.put("value", entry.getValue());
            fields.add(field);
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("id", id);
        request.put("fields", fields);

        log.info("Updating item '{}' in collection '{}' with {} field(s)", id, label, fields.size());
        JsonNode body = exchange(HttpMethod.PUT, uri(collection, id), request, "update")
                .orElseThrow(() -> new NotFoundException("item", id));

        if (isEmpty(body)) {
            // some deployments answer 204; read the item back
            return getById(collection, id).orElseThrow(() -> new NotFoundException("item", id));
        }
        return toItem(unwrapSingle(body));
    }

    @Override
    public boolean delete(String collection, String id) {
        requireId(id);
        String label = StoreSettings.label(collection);
        log.info("Deleting item '{}' from collection '{}'", id, label);

        boolean deleted = exchange(HttpMethod.DELETE, uri(collection, id), null, "delete").isPresent();
        if (!deleted) {
            log.warn("Nothing to delete for item '{}' in collection '{}'", id, label);
        }
        return deleted;
    }

    // ---- Transport ----

    /**
     * Issues one call. Empty means the store answered 404; every other failure is raised
     * as {@link RemoteStoreException}.
     */
    private Optional<JsonNode> exchange(HttpMethod method, URI uri, Object body, String operation) {
        HttpEntity<Object> entity = new HttpEntity<>(body, headers(body != null));
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(uri, method, entity, JsonNode.class);
            JsonNode payload = response.getBody();
            return Optional.of(payload != null ? payload : NullNode.getInstance());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Document store {} answered 404", operation);
            return Optional.empty();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.error("Document store {} failed with HTTP {}", operation, status);
            throw new RemoteStoreException(operation, status,
                    "Document store " + operation + " failed with HTTP " + status, e);
        } catch (RestClientException e) {
            log.error("Document store {} failed: {}", operation, e.getClass().getSimpleName());
            throw new RemoteStoreException(operation, "Document store " + operation + " failed", e);
        }
    }

    private HttpHeaders headers(boolean withBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.apiKey());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (withBody) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return headers;
    }

    private URI uri(String collection, String... path) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(settings.baseUrl());
        if (collection != null && !collection.isBlank()) {
            builder.pathSegment(collection);
        }
        if (path.length > 0) {
            builder.pathSegment(path);
        }
        return builder.build().encode().toUri();
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("item id cannot be empty");
        }
    }

    // ---- Response shape normalization ----

    /**
     * Flattens the read-all response. Accepted shapes: a list of items, an object with an
     * {@code items} list, or an object whose values are lists of items, each optionally
     * wrapped as {@code {"payload": {...}}}.
     */
    List<StoredItem> flatten(JsonNode body, String label) {
        List<StoredItem> items = new ArrayList<>();
        if (isEmpty(body)) {
            return items;
        }
        if (body.isArray()) {
            addItems(body, items);
            return items;
        }
        if (!body.isObject()) {
            log.warn("Unexpected response format from collection '{}': {}", label, body.getNodeType());
            return items;
        }
        JsonNode wrapped = body.get(ITEMS_KEY);
        if (wrapped != null && wrapped.isArray()) {
            addItems(wrapped, items);
            return items;
        }
        boolean keyedLists = false;
        Iterator<JsonNode> values = body.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isArray()) {
                keyedLists = true;
                addItems(value, items);
            }
        }
        if (!keyedLists) {
            log.debug("Response from collection '{}' is a single object", label);
            items.add(toItem(unwrapSingle(body)));
        }
        return items;
    }

    private void addItems(JsonNode array, List<StoredItem> into) {
        for (JsonNode element : array) {
            if (element.isObject()) {
                into.add(toItem(unwrapSingle(element)));
            }
        }
    }

    /**
     * Strips a {@code payload} or {@code collection_item} envelope, keeping any identifier
     * that sits on the envelope rather than inside it.
     */
    private Map<String, Object> unwrapSingle(JsonNode node) {
        Map<String, Object> outer = objectMapper.convertValue(node, MAP_TYPE);
        for (String envelope : new String[] {PAYLOAD_KEY, ITEM_WRAPPER_KEY}) {
            JsonNode inner = node.get(envelope);
            if (inner != null && inner.isObject()) {
                Map<String, Object> item = objectMapper.convertValue(inner, MAP_TYPE);
                for (String idKey : new String[] {StoredItem.AUTO_ID_KEY, StoredItem.ID_KEY}) {
                    if (outer.get(idKey) != null) {
                        item.putIfAbsent(idKey, outer.get(idKey));
                    }
                }
                return item;
            }
        }
        return outer;
    }

    private static StoredItem toItem(Map<String, Object> fields) {
        return StoredItem.of(fields);
    }

    private static boolean isEmpty(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode()
                || (node.isContainerNode() && node.size() == 0);
    }
}
