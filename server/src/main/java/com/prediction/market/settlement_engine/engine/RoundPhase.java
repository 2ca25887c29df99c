package com.prediction.market.settlement_engine.engine;

import com.prediction.market.settlement_engine.entity.Round;

/**
 * Lifecycle phase of the round slot, derived from the active round and the current ledger.
 *
 * IDLE → OPEN                     (round created)
 * OPEN → CLOSED_FOR_BETTING       (ledger reaches bet end)
 * CLOSED_FOR_BETTING → RESOLVABLE (ledger reaches end)
 * RESOLVABLE → IDLE               (round resolved)
 *
 * Phases only advance with the ledger; the one backward edge is resolution.
 */
public enum RoundPhase {

    /** No active round. Next: OPEN */
    IDLE,

    /** Staking allowed. */
    OPEN,

    /** Staking closed, waiting for the end marker. */
    CLOSED_FOR_BETTING,

    /** Oracle may resolve. Next: IDLE */
    RESOLVABLE;

    public static RoundPhase of(Round round, long sequence) {
        if (round == null) {
            return IDLE;
        }
        if (sequence < round.getBetEndLedger()) {
            return OPEN;
        }
        if (sequence < round.getEndLedger()) {
            return CLOSED_FOR_BETTING;
        }
        return RESOLVABLE;
    }

    public boolean acceptsStakes() {
        return this == OPEN;
    }

    /**
     * Validate a transition.
     *
     * @param to the target phase
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(RoundPhase to) {
        return switch (this) {
            case IDLE -> to == OPEN;
            case OPEN -> to == CLOSED_FOR_BETTING;
            case CLOSED_FOR_BETTING -> to == RESOLVABLE;
            case RESOLVABLE -> to == IDLE;
        };
    }
}
