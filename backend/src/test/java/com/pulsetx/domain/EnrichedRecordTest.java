package com.pulsetx.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichedRecordTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void pending_keepsLedgerFieldsAndHasNoHeartRate() {
        SignatureInfo info = new SignatureInfo("sig", 42L, 1_700_000_000L, "{\"InstructionError\":[0,\"Custom\"]}", "gm", "confirmed");

        EnrichedRecord record = EnrichedRecord.pending(info, NOW);

        assertThat(record.signature()).isEqualTo("sig");
        assertThat(record.slot()).isEqualTo(42L);
        assertThat(record.timestamp()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(record.timestampEstimated()).isFalse();
        assertThat(record.failedOnChain()).isTrue();
        assertThat(record.memo()).isEqualTo("gm");
        assertThat(record.confirmationStatus()).isEqualTo("confirmed");
        assertThat(record.heartRate()).isEmpty();
    }

    @Test
    void withHeartRate_keepsIdentity() {
        EnrichedRecord record = EnrichedRecord.pending(new SignatureInfo("sig", 1L, null, null, null, null), NOW);

        EnrichedRecord enriched = record.withHeartRate(81);

        assertThat(enriched.id()).isEqualTo(record.id());
        assertThat(enriched.timestamp()).isEqualTo(NOW);
        assertThat(enriched.timestampEstimated()).isTrue();
        assertThat(enriched.heartRate()).contains(81);
        assertThat(record.heartRateBpm()).isNull();
    }
}
