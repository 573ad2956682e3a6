package com.pulsetx.domain;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A ledger signature paired with the average heart rate around its block time.
 * memo and confirmationStatus are passed through from the ledger unchanged.
 * heartRateBpm is null until enrichment assigns it, and stays null when no samples exist.
 */
public record EnrichedRecord(
        UUID id,
        String signature,
        long slot,
        Instant timestamp,
        boolean timestampEstimated,
        boolean failedOnChain,
        String memo,
        String confirmationStatus,
        Integer heartRateBpm
) {

    /**
     * Builds an unenriched record. A missing blockTime falls back to {@code now} and marks the timestamp as estimated.
     */
    public static EnrichedRecord pending(SignatureInfo info, Instant now) {
        boolean estimated = info.blockTime() == null;
        Instant ts = estimated ? now : Instant.ofEpochSecond(info.blockTime());
        return new EnrichedRecord(UUID.randomUUID(), info.signature(), info.slot(), ts, estimated, info.failedOnChain(),
                info.memo(), info.confirmationStatus(), null);
    }

    public EnrichedRecord withHeartRate(Integer bpm) {
        return new EnrichedRecord(id, signature, slot, timestamp, timestampEstimated, failedOnChain, memo, confirmationStatus, bpm);
    }

    public Optional<Integer> heartRate() {
        return Optional.ofNullable(heartRateBpm);
    }
}
