package com.prediction.market.settlement_engine.ledger;

/**
 * Source of "now" for the engine. Implementations must never move backwards;
 * the engine only reads it.
 */
public interface LedgerClock {

    LedgerInfo current();
}
