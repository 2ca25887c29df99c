package com.prediction.market.settlement_engine.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.prediction.market.settlement_engine.entity.BetSide;
import com.prediction.market.settlement_engine.entity.OraclePayload;
import com.prediction.market.settlement_engine.entity.PrecisionPrediction;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.entity.UserPosition;
import com.prediction.market.settlement_engine.events.RoundResolvedEvent;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.service.OracleValidator;
import com.prediction.market.settlement_engine.service.PendingWinningsVault;
import com.prediction.market.settlement_engine.service.PositionBook;
import com.prediction.market.settlement_engine.service.StatsTracker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the active round against an oracle payload.
 *
 * Payouts are credited to pending winnings, never straight to balances. The round and
 * its stakes are retired in the same invocation, so a round is settled exactly once.
 *
 * Caller must have checked the oracle's authorization.
 */
@Slf4j
@RequiredArgsConstructor
public class SettlementEngine {

    private final RoundLifecycle roundLifecycle;
    private final PositionBook positionBook;
    private final OracleValidator oracleValidator;
    private final PendingWinningsVault pendingWinningsVault;
    private final StatsTracker statsTracker;
    private final PayoutCalculator payoutCalculator;

    public SettlementResult resolve(InvocationContext ctx, OraclePayload payload) {
        Round round = roundLifecycle.requireResolvableRound(ctx);
        oracleValidator.validate(payload, round, ctx.timestamp());

        SettlementResult result = switch (round.getMode()) {
            case UP_DOWN -> settleUpDown(ctx, round, payload.getPrice());
            case PRECISION -> settlePrecision(ctx, round, payload.getPrice());
        };

        roundLifecycle.retire(ctx);
        ctx.emit(new RoundResolvedEvent(result.getRoundId(), result.getRoundNumber(), result.getMode(),
                result.getFinalPrice(), result.getOutcome(), result.getWinners().size(), result.getTotalPaidOut()));

        log.info("Round {} resolved at {}: outcome={}, winners={}, paid={}, undistributed={}",
                round.getRoundNumber(), payload.getPrice(), result.getOutcome(), result.getWinners().size(),
                result.getTotalPaidOut(), result.getUndistributed());
        return result;
    }

    private SettlementResult settleUpDown(InvocationContext ctx, Round round, BigInteger finalPrice) {
        Map<String, UserPosition> positions = positionBook.upDownPositions(ctx).asMap();
        TokenAmount totalStaked = round.getPoolUp().add(round.getPoolDown());

        int cmp = finalPrice.compareTo(round.getPriceStart());
        if (cmp == 0) {
            return refundAll(ctx, round, finalPrice, positions, totalStaked);
        }

        BetSide winningSide = cmp > 0 ? BetSide.UP : BetSide.DOWN;
        TokenAmount winningPool = round.poolFor(winningSide);
        TokenAmount losingPool = round.poolFor(winningSide == BetSide.UP ? BetSide.DOWN : BetSide.UP);
        if (winningPool.isZero() || losingPool.isZero()) {
            return refundAll(ctx, round, finalPrice, positions, totalStaked);
        }

        Map<String, TokenAmount> payouts = new LinkedHashMap<>();
        List<String> winners = new ArrayList<>();
        List<String> losers = new ArrayList<>();
        TokenAmount paid = TokenAmount.ZERO;

        for (Map.Entry<String, UserPosition> entry : positions.entrySet()) {
            String user = entry.getKey();
            UserPosition position = entry.getValue();
            if (position.getSide() == winningSide) {
                TokenAmount payout = payoutCalculator.payout(position.getAmount(), losingPool, winningPool);
                pendingWinningsVault.accrue(ctx, user, payout);
                statsTracker.recordWin(ctx, user);
                payouts.put(user, payout);
                winners.add(user);
                paid = paid.add(payout);
                log.debug("Round {}: {} staked {} and receives {}", round.getRoundNumber(), user, position.getAmount(), payout);
            } else {
                statsTracker.recordLoss(ctx, user);
                losers.add(user);
            }
        }

        return result(round, finalPrice, winningSide == BetSide.UP ? ResolutionOutcome.UP_WINS : ResolutionOutcome.DOWN_WINS,
                payouts, winners, losers, totalStaked, paid);
    }

    // Every stake goes back untouched; nobody won or lost.
    private SettlementResult refundAll(InvocationContext ctx, Round round, BigInteger finalPrice,
            Map<String, UserPosition> positions, TokenAmount totalStaked) {
        Map<String, TokenAmount> payouts = new LinkedHashMap<>();
        TokenAmount paid = TokenAmount.ZERO;
        for (Map.Entry<String, UserPosition> entry : positions.entrySet()) {
            TokenAmount amount = entry.getValue().getAmount();
            pendingWinningsVault.accrue(ctx, entry.getKey(), amount);
            payouts.put(entry.getKey(), amount);
            paid = paid.add(amount);
        }
        return result(round, finalPrice, ResolutionOutcome.REFUND, payouts, List.of(), List.of(), totalStaked, paid);
    }

    private SettlementResult settlePrecision(InvocationContext ctx, Round round, BigInteger finalPrice) {
        List<PrecisionPrediction> predictions = positionBook.precisionPredictions(ctx).asList();

        TokenAmount pot = TokenAmount.ZERO;
        BigInteger best = null;
        for (PrecisionPrediction prediction : predictions) {
            pot = pot.add(prediction.getAmount());
            BigInteger distance = payoutCalculator.priceDistance(prediction.getPredictedPrice(), finalPrice);
            if (best == null || distance.compareTo(best) < 0) {
                best = distance;
            }
        }

        List<String> winners = new ArrayList<>();
        List<String> losers = new ArrayList<>();
        for (PrecisionPrediction prediction : predictions) {
            BigInteger distance = payoutCalculator.priceDistance(prediction.getPredictedPrice(), finalPrice);
            if (distance.equals(best)) {
                winners.add(prediction.getUser());
            } else {
                losers.add(prediction.getUser());
            }
        }

        Map<String, TokenAmount> payouts = new LinkedHashMap<>();
        TokenAmount paid = TokenAmount.ZERO;
        if (!winners.isEmpty()) {
            TokenAmount perWinner = payoutCalculator.splitPot(pot, winners.size());
            for (String winner : winners) {
                pendingWinningsVault.accrue(ctx, winner, perWinner);
                statsTracker.recordWin(ctx, winner);
                payouts.put(winner, perWinner);
                paid = paid.add(perWinner);
            }
            log.debug("Round {}: {} winner(s) at distance {}, {} each", round.getRoundNumber(), winners.size(), best, perWinner);
        }
        for (String loser : losers) {
            statsTracker.recordLoss(ctx, loser);
        }

        return result(round, finalPrice, ResolutionOutcome.PRECISION_SETTLED, payouts, winners, losers, pot, paid);
    }

    private static SettlementResult result(Round round, BigInteger finalPrice, ResolutionOutcome outcome,
            Map<String, TokenAmount> payouts, List<String> winners, List<String> losers,
            TokenAmount totalStaked, TokenAmount paid) {
        return SettlementResult.builder()
                .roundId(round.getRoundId())
                .roundNumber(round.getRoundNumber())
                .mode(round.getMode())
                .finalPrice(finalPrice)
                .outcome(outcome)
                .payouts(Collections.unmodifiableMap(payouts))
                .winners(Collections.unmodifiableList(winners))
                .losers(Collections.unmodifiableList(losers))
                .totalStaked(totalStaked)
                .totalPaidOut(paid)
                .undistributed(totalStaked.subtract(paid))
                .build();
    }
}
