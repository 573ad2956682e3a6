package com.pulsetx.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsetx.domain.SignatureInfo;
import com.pulsetx.ingestion.adapter.RpcEndpointRotator;
import com.pulsetx.ingestion.adapter.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches one page of getSignaturesForAddress, newest first, optionally before a cursor signature.
 * No retries: every failure is returned once as an {@link RpcException} with its kind.
 */
@Slf4j
public class LedgerSignatureClient {

    public static final String METHOD = "getSignaturesForAddress";

    /** Solana RPC accepts 1–1000 signatures per call. */
    public static final int MAX_LIMIT = 1000;

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final String commitment;

    public LedgerSignatureClient(SolanaRpcClient rpcClient,
                                 RpcEndpointRotator rotator,
                                 RateLimiter rateLimiter,
                                 ObjectMapper objectMapper,
                                 String commitment) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.commitment = commitment;
    }

    public Mono<List<SignatureInfo>> fetchPage(String address, int limit, String before) {
        if (address == null || address.isBlank()) {
            return Mono.error(new IllegalArgumentException("address is required"));
        }
        if (limit <= 0) {
            return Mono.error(new IllegalArgumentException("limit must be positive"));
        }
        List<Object> params = buildParams(address.trim(), Math.min(limit, MAX_LIMIT), before, commitment);
        return Mono.defer(() -> {
            long waitNanos = rateLimiter.reservePermission();
            if (waitNanos < 0) {
                return Mono.error(RpcException.transport("Local limiter timeout before " + METHOD, null));
            }
            String endpoint = rotator.getNextEndpoint();
            Mono<String> call = rpcClient.call(endpoint, METHOD, params);
            if (waitNanos > 0) {
                log.debug("Local ledger RPC limiter delayed {} ms before {}", waitNanos / 1_000_000L, METHOD);
                call = Mono.delay(Duration.ofNanos(waitNanos)).then(call);
            }
            return call;
        })
                .onErrorMap(e -> !(e instanceof RpcException),
                        e -> RpcException.transport(METHOD + " failed: " + e.getMessage(), e))
                .map(json -> parseSignaturePage(json, objectMapper));
    }

    /**
     * [address, {limit, before?, commitment?}]. limit is always present; before only when a cursor exists.
     */
    static List<Object> buildParams(String address, int limit, String before, String commitment) {
        Map<String, Object> options = new HashMap<>();
        options.put("limit", limit);
        if (before != null && !before.isBlank()) {
            options.put("before", before);
        }
        if (commitment != null && !commitment.isBlank()) {
            options.put("commitment", commitment);
        }
        List<Object> params = new ArrayList<>();
        params.add(address);
        params.add(options);
        return params;
    }

    static List<SignatureInfo> parseSignaturePage(String json, ObjectMapper mapper) {
        JsonNode root;
        try {
            root = json == null ? null : mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw RpcException.decode("Malformed " + METHOD + " response", e);
        }
        if (root == null || !root.isObject()) {
            throw RpcException.decode("Empty or non-object " + METHOD + " response");
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            int code = error.path("code").asInt(0);
            String message = error.path("message").asText(error.toString());
            throw RpcException.remoteRejected(code, METHOD + " error " + code + ": " + message);
        }
        JsonNode result = root.path("result");
        if (!result.isArray()) {
            throw RpcException.decode("No result array in " + METHOD + " response");
        }
        List<SignatureInfo> page = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            page.add(toSignatureInfo(node));
        }
        return page;
    }

    private static SignatureInfo toSignatureInfo(JsonNode node) {
        JsonNode signature = node.path("signature");
        if (!signature.isTextual() || signature.asText().isBlank()) {
            throw RpcException.decode("Signature entry without signature: " + node);
        }
        JsonNode blockTime = field(node, "blockTime", "block_time");
        JsonNode err = node.path("err");
        JsonNode memo = node.path("memo");
        JsonNode status = field(node, "confirmationStatus", "confirmation_status");
        return new SignatureInfo(
                signature.asText(),
                node.path("slot").asLong(0L),
                blockTime.isNumber() ? blockTime.asLong() : null,
                err.isMissingNode() || err.isNull() ? null : err.toString(),
                memo.isTextual() ? memo.asText() : null,
                status.isTextual() ? status.asText() : null);
    }

    private static JsonNode field(JsonNode node, String camel, String snake) {
        JsonNode value = node.path(camel);
        return value.isMissingNode() ? node.path(snake) : value;
    }
}
