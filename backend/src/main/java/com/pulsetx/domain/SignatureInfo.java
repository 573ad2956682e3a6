package com.pulsetx.domain;

/**
 * One entry of a getSignaturesForAddress page, as returned by the ledger RPC.
 * blockTime is Unix seconds and may be null; error is the raw JSON of the on-chain err, null when the tx succeeded.
 */
public record SignatureInfo(
        String signature,
        long slot,
        Long blockTime,
        String error,
        String memo,
        String confirmationStatus
) {

    public boolean failedOnChain() {
        return error != null;
    }
}
