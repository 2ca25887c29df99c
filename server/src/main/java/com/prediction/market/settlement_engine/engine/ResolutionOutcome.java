package com.prediction.market.settlement_engine.engine;

/**
 * How a resolved round paid out.
 */
public enum ResolutionOutcome {

    /** Up/Down round, price rose: Up stakers split the Down pool. */
    UP_WINS,

    /** Up/Down round, price fell: Down stakers split the Up pool. */
    DOWN_WINS,

    /** Up/Down round returned every stake: unchanged price or a one-sided book. */
    REFUND,

    /** Precision round: the closest guesses split the pot. */
    PRECISION_SETTLED
}
