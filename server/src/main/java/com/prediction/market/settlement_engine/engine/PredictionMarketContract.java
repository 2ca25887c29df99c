package com.prediction.market.settlement_engine.engine;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.prediction.market.settlement_engine.entity.BetSide;
import com.prediction.market.settlement_engine.entity.OraclePayload;
import com.prediction.market.settlement_engine.entity.PrecisionPrediction;
import com.prediction.market.settlement_engine.entity.Prices;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.entity.UserPosition;
import com.prediction.market.settlement_engine.entity.UserStats;
import com.prediction.market.settlement_engine.entity.WindowConfig;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.security.AccessController;
import com.prediction.market.settlement_engine.service.BalanceLedger;
import com.prediction.market.settlement_engine.service.PendingWinningsVault;
import com.prediction.market.settlement_engine.service.PositionBook;
import com.prediction.market.settlement_engine.service.StatsTracker;
import com.prediction.market.settlement_engine.service.WindowPolicy;

import lombok.RequiredArgsConstructor;

/**
 * The contract's public operations. Each method is one invocation: it runs against the
 * context it is given and either completes or throws {@link SettlementException}, in
 * which case the host discards everything it wrote.
 *
 * Gated operations check authorization before anything else.
 */
@RequiredArgsConstructor
public class PredictionMarketContract {

    private final AccessController accessController;
    private final WindowPolicy windowPolicy;
    private final RoundLifecycle roundLifecycle;
    private final PositionBook positionBook;
    private final SettlementEngine settlementEngine;
    private final PendingWinningsVault pendingWinningsVault;
    private final BalanceLedger balanceLedger;
    private final StatsTracker statsTracker;

    public void initialize(InvocationContext ctx, String admin, String oracle) {
        accessController.initialize(ctx, admin, oracle);
    }

    public WindowConfig setWindows(InvocationContext ctx, long betLedgers, long runLedgers) {
        accessController.requireAdmin(ctx);
        return windowPolicy.setWindows(ctx, betLedgers, runLedgers);
    }

    /**
     * @param mode mode code, {@code null} for Up/Down
     */
    public Round createRound(InvocationContext ctx, BigInteger startPrice, Integer mode) {
        accessController.requireAdmin(ctx);
        Prices.requireValidPrice(startPrice);
        RoundMode roundMode = mode == null ? RoundMode.UP_DOWN : RoundMode.fromCode(mode);
        return roundLifecycle.createRound(ctx, startPrice, roundMode);
    }

    public Round placeBet(InvocationContext ctx, String user, TokenAmount amount, BetSide side) {
        accessController.requireUser(ctx, user);
        requirePositive(amount);
        Round round = roundLifecycle.requireOpenRound(ctx);
        Round updated = positionBook.stakeUpDown(ctx, round, user, amount, side);
        roundLifecycle.saveRound(ctx, updated);
        return updated;
    }

    public void placePrecisionPrediction(InvocationContext ctx, String user, TokenAmount amount, long predictedPrice) {
        accessController.requireUser(ctx, user);
        requirePositive(amount);
        Round round = roundLifecycle.requireOpenRound(ctx);
        positionBook.stakePrecision(ctx, round, user, amount, predictedPrice);
    }

    /**
     * Same as {@link #placePrecisionPrediction} with the price before the amount.
     */
    public void predictPrice(InvocationContext ctx, String user, long guessedPrice, TokenAmount amount) {
        placePrecisionPrediction(ctx, user, amount, guessedPrice);
    }

    public SettlementResult resolveRound(InvocationContext ctx, OraclePayload payload) {
        accessController.requireOracle(ctx);
        return settlementEngine.resolve(ctx, payload);
    }

    public TokenAmount claimWinnings(InvocationContext ctx, String user) {
        accessController.requireUser(ctx, user);
        return pendingWinningsVault.claim(ctx, user);
    }

    public TokenAmount mintInitial(InvocationContext ctx, String user) {
        accessController.requireUser(ctx, user);
        return balanceLedger.mintInitial(ctx, user);
    }

    // Reads

    public WindowConfig getWindows(InvocationContext ctx) {
        return windowPolicy.currentWindows(ctx);
    }

    public Optional<String> getAdmin(InvocationContext ctx) {
        return accessController.admin(ctx);
    }

    public Optional<String> getOracle(InvocationContext ctx) {
        return accessController.oracle(ctx);
    }

    public Optional<Round> getActiveRound(InvocationContext ctx) {
        return roundLifecycle.activeRound(ctx);
    }

    public RoundPhase getRoundPhase(InvocationContext ctx) {
        return roundLifecycle.phase(ctx);
    }

    public long getLastRoundId(InvocationContext ctx) {
        return roundLifecycle.lastRoundId(ctx);
    }

    public UserStats getUserStats(InvocationContext ctx, String user) {
        return statsTracker.stats(ctx, user);
    }

    public TokenAmount getPendingWinnings(InvocationContext ctx, String user) {
        return pendingWinningsVault.pending(ctx, user);
    }

    public Optional<UserPosition> getUserPosition(InvocationContext ctx, String user) {
        return positionBook.position(ctx, user);
    }

    public Optional<PrecisionPrediction> getUserPrecisionPrediction(InvocationContext ctx, String user) {
        return positionBook.prediction(ctx, user);
    }

    public List<PrecisionPrediction> getPrecisionPredictions(InvocationContext ctx) {
        return positionBook.precisionPredictions(ctx).asList();
    }

    public Map<String, UserPosition> getUpDownPositions(InvocationContext ctx) {
        return positionBook.upDownPositions(ctx).asMap();
    }

    public TokenAmount balance(InvocationContext ctx, String user) {
        return balanceLedger.balance(ctx, user);
    }

    private static void requirePositive(TokenAmount amount) {
        if (amount == null || !amount.isPositive()) {
            throw new SettlementException(SettlementError.INVALID_BET_AMOUNT);
        }
    }
}
