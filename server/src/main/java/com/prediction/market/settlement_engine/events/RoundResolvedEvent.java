package com.prediction.market.settlement_engine.events;

import java.math.BigInteger;

import com.prediction.market.settlement_engine.engine.ResolutionOutcome;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.TokenAmount;

public record RoundResolvedEvent(
        long roundId,
        long roundNumber,
        RoundMode mode,
        BigInteger finalPrice,
        ResolutionOutcome outcome,
        int winnerCount,
        TokenAmount totalPaidOut) {

    public String type() {
        return SettlementEventTypes.ROUND_RESOLVED;
    }
}
