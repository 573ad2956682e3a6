package com.pulsetx.api.dto;

public record SessionCreatedResponse(String sessionId) {
}
