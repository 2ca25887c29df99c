package com.prediction.market.settlement_engine.engine;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.TokenAmount;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of one resolution. {@code undistributed} is the truncation remainder left
 * unpaid by integer division.
 */
@Getter
@ToString
@Builder
public class SettlementResult {
    private final long roundId;
    private final long roundNumber;
    private final RoundMode mode;
    private final BigInteger finalPrice;
    private final ResolutionOutcome outcome;
    private final Map<String, TokenAmount> payouts;
    private final List<String> winners;
    private final List<String> losers;
    private final TokenAmount totalStaked;
    private final TokenAmount totalPaidOut;
    private final TokenAmount undistributed;
}
