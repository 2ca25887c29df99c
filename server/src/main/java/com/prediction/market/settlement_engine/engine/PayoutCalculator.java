package com.prediction.market.settlement_engine.engine;

import java.math.BigInteger;

import com.prediction.market.settlement_engine.entity.TokenAmount;

/**
 * Payout arithmetic. All divisions truncate toward zero; callers account for the remainder.
 */
public class PayoutCalculator {

    // Winner's cut of the losing pool: floor(stake * losingPool / winningPool).
    public TokenAmount proportionalShare(TokenAmount stake, TokenAmount losingPool, TokenAmount winningPool) {
        return stake.multiply(losingPool).divide(winningPool);
    }

    // Stake returned plus the share of the losing pool.
    public TokenAmount payout(TokenAmount stake, TokenAmount losingPool, TokenAmount winningPool) {
        return stake.add(proportionalShare(stake, losingPool, winningPool));
    }

    // |predicted - observed|, both at the same scale.
    public BigInteger priceDistance(long predictedPrice, BigInteger observedPrice) {
        return BigInteger.valueOf(predictedPrice).subtract(observedPrice).abs();
    }

    // Equal split of the pot; the remainder stays in the contract.
    public TokenAmount splitPot(TokenAmount pot, int winnerCount) {
        if (winnerCount <= 0) {
            throw new IllegalArgumentException("Winner count must be positive");
        }
        return pot.divide(winnerCount);
    }
}
