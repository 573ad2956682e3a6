package com.pulsetx.api.dto;

import com.pulsetx.api.validation.WalletAddress;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/sessions/{id}/initial-fetch request body.
 */
public record InitialFetchRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @WalletAddress
        String address
) {
}
