package com.pulsetx.domain;

import java.time.Instant;

/**
 * Failure of one page operation. code is the JSON-RPC error code for REMOTE_REJECTED, the HTTP status
 * for TRANSPORT when one was received, otherwise null.
 */
public record FetchError(FetchErrorKind kind, Integer code, String message, Instant occurredAt) {

    public static FetchError of(FetchErrorKind kind, Integer code, String message, Instant occurredAt) {
        return new FetchError(kind, code, message, occurredAt);
    }
}
