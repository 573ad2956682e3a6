package com.pulsetx.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger (Solana) RPC endpoints and local throttling. Documented in application.yml under pulsetx.ledger.
 */
@ConfigurationProperties(prefix = "pulsetx.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerRpcProperties {

    /** RPC URLs used round-robin. Empty falls back to the public mainnet endpoint. */
    private List<String> urls = new ArrayList<>();

    /** Optional provider key, appended to every URL as the api-key query parameter. */
    private String apiKey;

    /** Optional commitment for getSignaturesForAddress (processed, confirmed, finalized). Omitted when blank. */
    private String commitment;

    /** Requests per second allowed by the local limiter. */
    private int maxRequestsPerSecond = 10;

    /** How long a call may wait for a limiter permit before failing. */
    private long localLimiterTimeoutMs = 2_000;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
