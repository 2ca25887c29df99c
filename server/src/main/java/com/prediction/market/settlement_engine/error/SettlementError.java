package com.prediction.market.settlement_engine.error;

/**
 * Closed set of failure kinds an operation can report.
 *
 * Codes are stable and part of the external interface; never renumber.
 */
public enum SettlementError {

    // Initialization state
    ALREADY_INITIALIZED(1),
    ADMIN_NOT_SET(2),
    ORACLE_NOT_SET(3),

    // Authorization
    UNAUTHORIZED_ADMIN(4),
    UNAUTHORIZED_ORACLE(5),

    // Validation / lifecycle / staking (original numbering)
    INVALID_BET_AMOUNT(6),
    NO_ACTIVE_ROUND(7),
    ROUND_ENDED(8),
    INSUFFICIENT_BALANCE(9),
    ALREADY_BET(10),
    OVERFLOW(11),
    INVALID_PRICE(12),
    INVALID_DURATION(13),
    ROUND_NOT_ENDED(14),
    ROUND_ALREADY_ACTIVE(15),
    INVALID_MODE(16),
    WRONG_MODE_FOR_PREDICTION(17),
    INVALID_PRICE_SCALE(18),

    // Oracle integrity
    STALE_ORACLE_DATA(19),
    INVALID_ORACLE_ROUND(20),

    UNAUTHORIZED_USER(21);

    private final int code;

    SettlementError(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static SettlementError fromCode(int code) {
        for (SettlementError error : values()) {
            if (error.code == code) {
                return error;
            }
        }
        throw new IllegalArgumentException("Unknown settlement error code: " + code);
    }
}
