package com.pulsetx.ingestion.adapter;

import com.pulsetx.domain.FetchError;
import com.pulsetx.domain.FetchErrorKind;
import lombok.Getter;

import java.time.Instant;

/**
 * Thrown when a ledger RPC call fails. Carries the failure kind and, where known, the remote or HTTP code.
 */
@Getter
public class RpcException extends RuntimeException {

    private final FetchErrorKind kind;
    private final Integer code;

    public RpcException(FetchErrorKind kind, Integer code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static RpcException transport(String message, Throwable cause) {
        return new RpcException(FetchErrorKind.TRANSPORT, null, message, cause);
    }

    public static RpcException transport(int httpStatus, String message, Throwable cause) {
        return new RpcException(FetchErrorKind.TRANSPORT, httpStatus, message, cause);
    }

    public static RpcException decode(String message) {
        return new RpcException(FetchErrorKind.DECODE, null, message, null);
    }

    public static RpcException decode(String message, Throwable cause) {
        return new RpcException(FetchErrorKind.DECODE, null, message, cause);
    }

    public static RpcException remoteRejected(int code, String message) {
        return new RpcException(FetchErrorKind.REMOTE_REJECTED, code, message, null);
    }

    public FetchError toFetchError(Instant occurredAt) {
        return FetchError.of(kind, code, getMessage(), occurredAt);
    }
}
