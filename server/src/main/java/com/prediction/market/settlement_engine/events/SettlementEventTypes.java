package com.prediction.market.settlement_engine.events;

public final class SettlementEventTypes {

    private SettlementEventTypes() {
    }

    public static final String ROUND_CREATED = "round.created";
    public static final String ROUND_RESOLVED = "round.resolved";
}
