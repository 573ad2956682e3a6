package com.pulsetx.domain;

/**
 * Result of a single initialFetch or loadMore call.
 */
public record PageOutcome(Status status, int appended, String cursor, FetchError error) {

    public enum Status {
        /** A non-empty page was enriched and appended. */
        APPENDED,
        /** The ledger returned an empty page; nothing changed. */
        EXHAUSTED,
        /** Another fetch was in flight; the call was a no-op. */
        REJECTED_BUSY,
        /** loadMore with no cursor yet; the call was a no-op. */
        NO_CURSOR,
        /** The page fetch failed; nothing was appended. */
        FAILED
    }

    public static PageOutcome appended(int count, String cursor) {
        return new PageOutcome(Status.APPENDED, count, cursor, null);
    }

    public static PageOutcome exhausted(String cursor) {
        return new PageOutcome(Status.EXHAUSTED, 0, cursor, null);
    }

    public static PageOutcome rejectedBusy(String cursor) {
        return new PageOutcome(Status.REJECTED_BUSY, 0, cursor, null);
    }

    public static PageOutcome noCursor() {
        return new PageOutcome(Status.NO_CURSOR, 0, null, null);
    }

    public static PageOutcome failed(FetchError error, String cursor) {
        return new PageOutcome(Status.FAILED, 0, cursor, error);
    }
}
