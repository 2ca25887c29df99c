package com.prediction.market.settlement_engine.store;

/**
 * Key namespaces of the contract state. Per-user namespaces need a user to address a value.
 */
public enum StateNamespace {
    BALANCE(true),
    ADMIN(false),
    ORACLE(false),
    ACTIVE_ROUND(false),
    UPDOWN_POSITIONS(false),
    PRECISION_POSITIONS(false),
    PENDING_WINNINGS(true),
    USER_STATS(true),
    WINDOW_CONFIG(false),
    LAST_ROUND_ID(false);

    private final boolean perUser;

    StateNamespace(boolean perUser) {
        this.perUser = perUser;
    }

    public boolean isPerUser() {
        return perUser;
    }
}
