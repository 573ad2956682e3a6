package com.pulsetx.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsetx.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Solana JSON-RPC client using WebClient. A non-2xx reply whose body is a JSON-RPC error envelope is returned
 * as the body so the caller reports the remote error; other HTTP and connection failures surface as TRANSPORT.
 */
@Slf4j
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientSolanaRpcClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.class, e -> {
                    String responseBody = e.getResponseBodyAsString();
                    if (isErrorEnvelope(responseBody)) {
                        log.debug("{} HTTP {} carried a JSON-RPC error envelope", method, e.getStatusCode().value());
                        return Mono.just(responseBody);
                    }
                    return Mono.error(RpcException.transport(e.getStatusCode().value(),
                            method + " HTTP " + e.getStatusCode().value(), e));
                })
                .onErrorMap(WebClientRequestException.class,
                        e -> RpcException.transport(method + " request failed: " + e.getMessage(), e));
    }

    private boolean isErrorEnvelope(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return false;
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            return root != null && root.isObject() && root.path("error").isObject();
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
