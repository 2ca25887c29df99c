package com.prediction.market.settlement_engine.entity;

import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;

/**
 * Settlement mode of a round. The numeric code is what callers pass to create a round.
 */
public enum RoundMode {

    /** Stakers pick a side; winners split the losing pool pro rata. */
    UP_DOWN(0),

    /** Stakers guess the exact price; closest guesses split the pot. */
    PRECISION(1);

    private final int code;

    RoundMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static RoundMode fromCode(int code) {
        for (RoundMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new SettlementException(SettlementError.INVALID_MODE, "unknown mode " + code);
    }
}
