package com.pulsetx.domain;

/**
 * Why a page fetch was aborted.
 */
public enum FetchErrorKind {
    /** HTTP or connection failure, or the local limiter refused a permit. */
    TRANSPORT,
    /** Response body was not a well-formed signatures envelope. */
    DECODE,
    /** JSON-RPC envelope carried an error member. */
    REMOTE_REJECTED,
    /** The page operation exceeded the configured page timeout. */
    TIMEOUT
}
