package com.pulsetx.heartrate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsetx.heartrate.HeartRateStore;
import com.pulsetx.heartrate.store.InMemoryHeartRateStore;
import com.pulsetx.heartrate.store.WebClientHeartRateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Heart-rate store selection (pulsetx.heart-rate.store) and the read-grant holder.
 */
@Configuration
@EnableConfigurationProperties(HeartRateProperties.class)
@Slf4j
public class HeartRateConfig {

    @Bean
    public SwitchableHeartRateAuthorization heartRateAuthorization(HeartRateProperties properties) {
        return new SwitchableHeartRateAuthorization(properties.isReadGranted());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulsetx.heart-rate", name = "store", havingValue = "MEMORY", matchIfMissing = true)
    public InMemoryHeartRateStore inMemoryHeartRateStore() {
        log.info("Heart-rate store: in-memory");
        return new InMemoryHeartRateStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulsetx.heart-rate", name = "store", havingValue = "REMOTE")
    public HeartRateStore webClientHeartRateStore(HeartRateProperties properties,
                                                  WebClient.Builder webClientBuilder,
                                                  ObjectMapper objectMapper) {
        String baseUrl = properties.getRemote().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("pulsetx.heart-rate.remote.base-url is required when store=REMOTE");
        }
        log.info("Heart-rate store: remote {}", baseUrl);
        return new WebClientHeartRateStore(webClientBuilder, baseUrl, properties.getRemote().getApiToken(), objectMapper);
    }
}
