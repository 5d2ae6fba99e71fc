package io.github.drompincen.bugtrackr.persistence.store;

import java.time.Duration;

/**
 * Connection settings for the document store, fixed at construction of the adapter.
 *
 * @param baseUrl    store base URL; the base collection lives directly under it
 * @param apiKey     static bearer credential sent on every call
 * @param timeout    connect and read timeout shared by all calls
 * @param collection physical collection all entity kinds are multiplexed into;
 *                   empty addresses the base collection
 */
public record StoreSettings(String baseUrl, String apiKey, Duration timeout, String collection) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public StoreSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Document store base URL cannot be empty");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Document store API key cannot be empty");
        }
        baseUrl = baseUrl.strip();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : DEFAULT_TIMEOUT;
        collection = collection != null ? collection.strip() : "";
    }

    /** Collection name for messages; the base collection reads as "base". */
    public static String label(String collection) {
        return collection == null || collection.isEmpty() ? "base" : collection;
    }

    @Override
    public String toString() {
        return "StoreSettings[timeout=" + timeout + ", collection=" + label(collection) + "]";
    }
}
