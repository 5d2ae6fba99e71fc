package io.github.drompincen.bugtrackr.gateway.config;

import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "bugtrackr.store")
public class StoreProperties {

    /**
     * Base URL of the document store API. The base collection lives directly under it.
     */
    private String baseUrl;

    /**
     * Bearer credential sent on every call. Supply it through the environment
     * ({@code BUGTRACKR_STORE_API_KEY}), never in a committed file.
     */
    private String apiKey;

    /**
     * Connect and read timeout for store calls.
     */
    private Duration timeout = StoreSettings.DEFAULT_TIMEOUT;

    /**
     * Collection all entity kinds share. Empty addresses the base collection.
     */
    private String collection = "";

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }

    /**
     * @throws IllegalStateException if the base URL or the credential is missing
     */
    public StoreSettings toSettings() {
        return new StoreSettings(baseUrl, apiKey, timeout, collection);
    }
}
