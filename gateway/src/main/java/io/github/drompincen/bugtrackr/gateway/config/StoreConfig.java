package io.github.drompincen.bugtrackr.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.HttpDocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StoreSettings storeSettings(StoreProperties properties) {
        return properties.toSettings();
    }

    @Bean
    RestTemplate storeRestTemplate(RestTemplateBuilder builder, StoreSettings settings) {
        return builder
                .setConnectTimeout(settings.timeout())
                .setReadTimeout(settings.timeout())
                .build();
    }

    @Bean
    DocumentStoreClient documentStoreClient(RestTemplate storeRestTemplate, ObjectMapper objectMapper,
                                            StoreSettings settings) {
        return new HttpDocumentStoreClient(storeRestTemplate, objectMapper, settings);
    }
}
