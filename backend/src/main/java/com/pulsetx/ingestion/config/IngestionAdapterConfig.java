package com.pulsetx.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsetx.ingestion.adapter.RpcEndpointRotator;
import com.pulsetx.ingestion.adapter.solana.LedgerSignatureClient;
import com.pulsetx.ingestion.adapter.solana.SolanaRpcClient;
import com.pulsetx.ingestion.adapter.solana.WebClientSolanaRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.List;

/**
 * Wires the ledger RPC client: rotator over configured URLs, local rate limiter, WebClient transport.
 */
@Configuration
@EnableConfigurationProperties(LedgerRpcProperties.class)
public class IngestionAdapterConfig {

    /** Used when pulsetx.ledger.urls is empty. */
    static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://api.mainnet-beta.solana.com");

    @Bean
    public RpcEndpointRotator ledgerRpcEndpointRotator(LedgerRpcProperties properties) {
        List<String> urls = properties.getUrls().isEmpty() ? DEFAULT_FALLBACK_URLS : properties.getUrls();
        return new RpcEndpointRotator(urls.stream()
                .map(url -> withApiKey(url, properties.getApiKey()))
                .toList());
    }

    @Bean(name = "ledgerRpcRateLimiter")
    public RateLimiter ledgerRpcRateLimiter(LedgerRpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger-rpc", config);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        return new WebClientSolanaRpcClient(webClientBuilder, objectMapper);
    }

    @Bean
    public LedgerSignatureClient ledgerSignatureClient(SolanaRpcClient solanaRpcClient,
                                                       RpcEndpointRotator ledgerRpcEndpointRotator,
                                                       @Qualifier("ledgerRpcRateLimiter") RateLimiter ledgerRpcRateLimiter,
                                                       ObjectMapper objectMapper,
                                                       LedgerRpcProperties properties) {
        return new LedgerSignatureClient(solanaRpcClient, ledgerRpcEndpointRotator, ledgerRpcRateLimiter,
                objectMapper, properties.getCommitment());
    }

    static String withApiKey(String url, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return url;
        }
        return UriComponentsBuilder.fromHttpUrl(url)
                .queryParam("api-key", apiKey)
                .build()
                .toUriString();
    }
}
