package com.prediction.market.settlement_engine.service;

import java.util.Optional;

import com.prediction.market.settlement_engine.entity.BetSide;
import com.prediction.market.settlement_engine.entity.PrecisionPrediction;
import com.prediction.market.settlement_engine.entity.PrecisionPredictions;
import com.prediction.market.settlement_engine.entity.Prices;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.entity.UpDownPositions;
import com.prediction.market.settlement_engine.entity.UserPosition;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.store.DataKey;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stakes of the active round, one sub-ledger per mode.
 *
 * The caller resolves the open round and passes it in; the book returns the round with
 * its pools updated so the caller can persist it alongside the position.
 */
@Slf4j
@RequiredArgsConstructor
public class PositionBook {

    private final BalanceLedger balanceLedger;

    public UpDownPositions upDownPositions(InvocationContext ctx) {
        return ctx.store().get(DataKey.upDownPositions(), UpDownPositions.class).orElseGet(UpDownPositions::empty);
    }

    public PrecisionPredictions precisionPredictions(InvocationContext ctx) {
        return ctx.store().get(DataKey.precisionPositions(), PrecisionPredictions.class)
                .orElseGet(PrecisionPredictions::empty);
    }

    public Optional<UserPosition> position(InvocationContext ctx, String user) {
        return upDownPositions(ctx).get(user);
    }

    public Optional<PrecisionPrediction> prediction(InvocationContext ctx, String user) {
        return precisionPredictions(ctx).findByUser(user);
    }

    /**
     * Record an Up/Down stake: debit the user, add to the side's pool, store the position.
     *
     * @return the round with the updated pool
     */
    public Round stakeUpDown(InvocationContext ctx, Round round, String user, TokenAmount amount, BetSide side) {
        if (round.getMode() != RoundMode.UP_DOWN) {
            throw new SettlementException(SettlementError.WRONG_MODE_FOR_PREDICTION, "round is " + round.getMode());
        }
        UpDownPositions positions = upDownPositions(ctx);
        if (positions.contains(user)) {
            throw new SettlementException(SettlementError.ALREADY_BET);
        }

        balanceLedger.debit(ctx, user, amount);
        Round updated = round.withStake(side, amount);
        ctx.store().put(DataKey.upDownPositions(),
                positions.with(user, UserPosition.builder().amount(amount).side(side).build()));

        log.info("User {} staked {} on {} in round {}", user, amount, side, round.getRoundNumber());
        return updated;
    }

    /**
     * Record a precision prediction: debit the user and append the guess.
     * Precision rounds keep their pot in the prediction list, the round itself is unchanged.
     */
    public Round stakePrecision(InvocationContext ctx, Round round, String user, TokenAmount amount, long predictedPrice) {
        if (round.getMode() != RoundMode.PRECISION) {
            throw new SettlementException(SettlementError.WRONG_MODE_FOR_PREDICTION, "round is " + round.getMode());
        }
        if (!Prices.isValidPrecisionPrice(predictedPrice)) {
            throw new SettlementException(SettlementError.INVALID_PRICE_SCALE,
                    String.format("predicted price %d outside [%d, %d]",
                            predictedPrice, Prices.MIN_PRECISION_PRICE, Prices.MAX_PRECISION_PRICE));
        }
        PrecisionPredictions predictions = precisionPredictions(ctx);
        if (predictions.containsUser(user)) {
            throw new SettlementException(SettlementError.ALREADY_BET);
        }

        balanceLedger.debit(ctx, user, amount);
        ctx.store().put(DataKey.precisionPositions(), predictions.with(PrecisionPrediction.builder()
                .user(user)
                .amount(amount)
                .predictedPrice(predictedPrice)
                .build()));

        log.info("User {} predicted {} with {} in round {}", user, predictedPrice, amount, round.getRoundNumber());
        return round;
    }

    /**
     * Drop both sub-ledgers.
     */
    public void clear(InvocationContext ctx) {
        ctx.store().remove(DataKey.upDownPositions());
        ctx.store().remove(DataKey.precisionPositions());
    }
}
