package com.prediction.market.settlement_engine.ledger;

/**
 * Ledger position observed at the start of an invocation.
 *
 * @param sequence monotonic ledger sequence number, used for round windows
 * @param timestamp ledger close time in seconds, used for oracle freshness
 */
public record LedgerInfo(long sequence, long timestamp) {

    public LedgerInfo {
        if (sequence < 0 || timestamp < 0) {
            throw new IllegalArgumentException("Ledger sequence and timestamp must be non-negative");
        }
    }
}
