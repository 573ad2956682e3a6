package com.pulsetx.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC transport. Returns the raw response body; envelope parsing is done by the caller.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
