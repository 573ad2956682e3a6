package com.pulsetx.api.dto;

/**
 * Body of GET/PUT /api/v1/heart-rate/authorization.
 */
public record HeartRateAuthorizationDto(boolean readGranted) {
}
