package com.prediction.market.settlement_engine.events;

import java.math.BigInteger;

import com.prediction.market.settlement_engine.entity.RoundMode;

public record RoundCreatedEvent(
        long roundId,
        long roundNumber,
        RoundMode mode,
        BigInteger startPrice,
        long betEndLedger,
        long endLedger) {

    public String type() {
        return SettlementEventTypes.ROUND_CREATED;
    }
}
