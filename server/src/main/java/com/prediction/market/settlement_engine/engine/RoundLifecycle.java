package com.prediction.market.settlement_engine.engine;

import java.math.BigInteger;
import java.util.Optional;

import com.prediction.market.settlement_engine.entity.Prices;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.WindowConfig;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.events.RoundCreatedEvent;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.service.PositionBook;
import com.prediction.market.settlement_engine.service.WindowPolicy;
import com.prediction.market.settlement_engine.store.DataKey;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the single round slot: creation, phase checks and retirement.
 *
 * Phase is never stored. It is recomputed from the round markers and the ledger
 * sequence of the current invocation, see {@link RoundPhase#of}.
 */
@Slf4j
@RequiredArgsConstructor
public class RoundLifecycle {

    private static final long MAX_ROUND_NUMBER = 0xFFFF_FFFFL;

    private final WindowPolicy windowPolicy;
    private final PositionBook positionBook;

    public Optional<Round> activeRound(InvocationContext ctx) {
        return ctx.store().get(DataKey.activeRound(), Round.class);
    }

    public RoundPhase phase(InvocationContext ctx) {
        return RoundPhase.of(activeRound(ctx).orElse(null), ctx.sequence());
    }

    /**
     * @return number of the most recently created round, 0 before the first one
     */
    public long lastRoundId(InvocationContext ctx) {
        return ctx.store().get(DataKey.lastRoundId(), Long.class).orElse(0L);
    }

    /**
     * Open a new round starting at the current ledger.
     *
     * @param startPrice reference price, must be non-zero
     * @param mode settlement mode
     * @return the created round
     */
    public Round createRound(InvocationContext ctx, BigInteger startPrice, RoundMode mode) {
        Prices.requireValidPrice(startPrice);
        if (activeRound(ctx).isPresent()) {
            throw new SettlementException(SettlementError.ROUND_ALREADY_ACTIVE);
        }

        long roundNumber = lastRoundId(ctx) + 1;
        if (roundNumber > MAX_ROUND_NUMBER) {
            throw new SettlementException(SettlementError.OVERFLOW, "round number");
        }

        WindowConfig windows = windowPolicy.currentWindows(ctx);
        long start = ctx.sequence();
        Round round = Round.builder()
                .mode(mode)
                .roundNumber(roundNumber)
                .startLedger(start)
                .betEndLedger(windowPolicy.betEndLedger(windows, start))
                .endLedger(windowPolicy.endLedger(windows, start))
                .priceStart(startPrice)
                .build();

        ctx.store().put(DataKey.activeRound(), round);
        ctx.store().put(DataKey.lastRoundId(), roundNumber);
        ctx.emit(new RoundCreatedEvent(round.getRoundId(), roundNumber, mode, startPrice,
                round.getBetEndLedger(), round.getEndLedger()));

        log.info("Round {} created: mode={}, startPrice={}, ledgers [{}, {}, {}]",
                roundNumber, mode, startPrice, start, round.getBetEndLedger(), round.getEndLedger());
        return round;
    }

    /**
     * @return the active round, if it still accepts stakes
     */
    public Round requireOpenRound(InvocationContext ctx) {
        Round round = activeRound(ctx).orElseThrow(() -> new SettlementException(SettlementError.NO_ACTIVE_ROUND));
        if (!RoundPhase.of(round, ctx.sequence()).acceptsStakes()) {
            throw new SettlementException(SettlementError.ROUND_ENDED,
                    String.format("betting closed at ledger %d", round.getBetEndLedger()));
        }
        return round;
    }

    /**
     * @return the active round, if its run window has elapsed
     */
    public Round requireResolvableRound(InvocationContext ctx) {
        Round round = activeRound(ctx).orElseThrow(() -> new SettlementException(SettlementError.NO_ACTIVE_ROUND));
        if (RoundPhase.of(round, ctx.sequence()) != RoundPhase.RESOLVABLE) {
            throw new SettlementException(SettlementError.ROUND_NOT_ENDED,
                    String.format("round ends at ledger %d", round.getEndLedger()));
        }
        return round;
    }

    public void saveRound(InvocationContext ctx, Round round) {
        ctx.store().put(DataKey.activeRound(), round);
    }

    /**
     * Remove the round and all of its stakes, returning the slot to IDLE.
     */
    public void retire(InvocationContext ctx) {
        RoundPhase current = phase(ctx);
        if (!current.canTransitionTo(RoundPhase.IDLE)) {
            throw new IllegalStateException("Cannot retire round in phase " + current);
        }
        ctx.store().remove(DataKey.activeRound());
        positionBook.clear(ctx);
    }
}
