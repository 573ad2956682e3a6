package com.pulsetx.api.dto;

import com.pulsetx.domain.FetchError;

import java.time.Instant;

public record FetchErrorResponse(String kind, Integer code, String message, Instant occurredAt) {

    public static FetchErrorResponse from(FetchError error) {
        if (error == null) {
            return null;
        }
        return new FetchErrorResponse(error.kind().name(), error.code(), error.message(), error.occurredAt());
    }
}
