package com.prediction.market.settlement_engine.service;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.prediction.market.settlement_engine.engine.PredictionMarketContract;
import com.prediction.market.settlement_engine.engine.RoundPhase;
import com.prediction.market.settlement_engine.engine.SettlementResult;
import com.prediction.market.settlement_engine.entity.BetSide;
import com.prediction.market.settlement_engine.entity.OraclePayload;
import com.prediction.market.settlement_engine.entity.PrecisionPrediction;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.entity.UserPosition;
import com.prediction.market.settlement_engine.entity.UserStats;
import com.prediction.market.settlement_engine.entity.WindowConfig;
import com.prediction.market.settlement_engine.execution.ContractExecutor;
import com.prediction.market.settlement_engine.security.CallAuthorization;

import lombok.RequiredArgsConstructor;

/**
 * Entry point for callers outside the engine. Every write runs as one atomic invocation
 * on the {@link ContractExecutor}; reads run without authorization.
 */
@RequiredArgsConstructor
public class PredictionMarketService {

    private final ContractExecutor executor;
    private final PredictionMarketContract contract;

    public void initialize(CallAuthorization auth, String admin, String oracle) {
        executor.invoke(auth, ctx -> {
            contract.initialize(ctx, admin, oracle);
            return null;
        });
    }

    public WindowConfig setWindows(CallAuthorization auth, long betLedgers, long runLedgers) {
        return executor.invoke(auth, ctx -> contract.setWindows(ctx, betLedgers, runLedgers));
    }

    public Round createRound(CallAuthorization auth, BigInteger startPrice, Integer mode) {
        return executor.invoke(auth, ctx -> contract.createRound(ctx, startPrice, mode));
    }

    public Round placeBet(CallAuthorization auth, String user, TokenAmount amount, BetSide side) {
        return executor.invoke(auth, ctx -> contract.placeBet(ctx, user, amount, side));
    }

    public void placePrecisionPrediction(CallAuthorization auth, String user, TokenAmount amount, long predictedPrice) {
        executor.invoke(auth, ctx -> {
            contract.placePrecisionPrediction(ctx, user, amount, predictedPrice);
            return null;
        });
    }

    public void predictPrice(CallAuthorization auth, String user, long guessedPrice, TokenAmount amount) {
        executor.invoke(auth, ctx -> {
            contract.predictPrice(ctx, user, guessedPrice, amount);
            return null;
        });
    }

    public SettlementResult resolveRound(CallAuthorization auth, OraclePayload payload) {
        return executor.invoke(auth, ctx -> contract.resolveRound(ctx, payload));
    }

    public TokenAmount claimWinnings(CallAuthorization auth, String user) {
        return executor.invoke(auth, ctx -> contract.claimWinnings(ctx, user));
    }

    public TokenAmount mintInitial(CallAuthorization auth, String user) {
        return executor.invoke(auth, ctx -> contract.mintInitial(ctx, user));
    }

    public WindowConfig getWindows() {
        return executor.query(contract::getWindows);
    }

    public Optional<String> getAdmin() {
        return executor.query(contract::getAdmin);
    }

    public Optional<String> getOracle() {
        return executor.query(contract::getOracle);
    }

    public Optional<Round> getActiveRound() {
        return executor.query(contract::getActiveRound);
    }

    public RoundPhase getRoundPhase() {
        return executor.query(contract::getRoundPhase);
    }

    public long getLastRoundId() {
        return executor.query(contract::getLastRoundId);
    }

    public UserStats getUserStats(String user) {
        return executor.query(ctx -> contract.getUserStats(ctx, user));
    }

    public TokenAmount getPendingWinnings(String user) {
        return executor.query(ctx -> contract.getPendingWinnings(ctx, user));
    }

    public Optional<UserPosition> getUserPosition(String user) {
        return executor.query(ctx -> contract.getUserPosition(ctx, user));
    }

    public Optional<PrecisionPrediction> getUserPrecisionPrediction(String user) {
        return executor.query(ctx -> contract.getUserPrecisionPrediction(ctx, user));
    }

    public List<PrecisionPrediction> getPrecisionPredictions() {
        return executor.query(contract::getPrecisionPredictions);
    }

    public Map<String, UserPosition> getUpDownPositions() {
        return executor.query(contract::getUpDownPositions);
    }

    public TokenAmount balance(String user) {
        return executor.query(ctx -> contract.balance(ctx, user));
    }
}
