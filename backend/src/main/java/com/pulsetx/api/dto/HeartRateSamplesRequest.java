package com.pulsetx.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.List;

/**
 * POST /api/v1/heart-rate/samples request body.
 */
public record HeartRateSamplesRequest(
        @NotEmpty(message = "NO_SAMPLES")
        List<@Valid Sample> samples
) {

    public record Sample(
            @NotNull(message = "INVALID_SAMPLE") Instant timestamp,
            @Positive(message = "INVALID_SAMPLE") double bpm
    ) {
    }
}
