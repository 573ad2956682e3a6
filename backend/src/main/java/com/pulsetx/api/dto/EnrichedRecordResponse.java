package com.pulsetx.api.dto;

import java.time.Instant;
import java.util.UUID;

public record EnrichedRecordResponse(
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
}
