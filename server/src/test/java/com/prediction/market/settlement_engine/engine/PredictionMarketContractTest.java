package com.prediction.market.settlement_engine.engine;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.settlement_engine.entity.BetSide;
import com.prediction.market.settlement_engine.entity.OraclePayload;
import com.prediction.market.settlement_engine.entity.PrecisionPrediction;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.entity.WindowConfig;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.events.RoundCreatedEvent;
import com.prediction.market.settlement_engine.events.RoundResolvedEvent;
import com.prediction.market.settlement_engine.service.PredictionMarketService;
import com.prediction.market.settlement_engine.support.ContractFixture;

import static com.prediction.market.settlement_engine.support.ContractFixture.ADMIN;
import static com.prediction.market.settlement_engine.support.ContractFixture.ORACLE;
import static com.prediction.market.settlement_engine.support.ContractFixture.as;
import static org.junit.jupiter.api.Assertions.*;

class PredictionMarketContractTest {

    private static final TokenAmount STAKE = TokenAmount.of(1_000_000_000L);

    private ContractFixture fixture;
    private PredictionMarketService service;

    @BeforeEach
    void setUp() {
        fixture = new ContractFixture();
        service = fixture.service;
        fixture.initialize();
        service.mintInitial(as("user1"), "user1");
        service.mintInitial(as("user2"), "user2");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void upDownRound_endToEnd() {
        service.createRound(as(ADMIN), BigInteger.valueOf(1_000_000), null);
        service.placeBet(as("user1"), "user1", STAKE, BetSide.UP);
        service.placeBet(as("user2"), "user2", STAKE, BetSide.DOWN);

        Round round = service.getActiveRound().orElseThrow();
        assertEquals(RoundMode.UP_DOWN, round.getMode());
        assertEquals(STAKE, round.getPoolUp());
        assertEquals(STAKE, round.getPoolDown());
        assertEquals(2, service.getUpDownPositions().size());

        fixture.clock.advance(12);
        service.resolveRound(as(ORACLE), payload(1_500_000, round.getRoundId()));

        assertTrue(service.getActiveRound().isEmpty());
        assertEquals(RoundPhase.IDLE, service.getRoundPhase());
        assertEquals(TokenAmount.of(2_000_000_000L), service.getPendingWinnings("user1"));
        assertEquals(TokenAmount.ZERO, service.getPendingWinnings("user2"));
        assertTrue(service.getUserStats("user1").getTotalWins() >= 1);
        assertTrue(service.getUserStats("user2").getTotalLosses() >= 1);
        assertTrue(service.getUserPosition("user1").isEmpty());

        TokenAmount before = service.balance("user1");
        TokenAmount claimed = service.claimWinnings(as("user1"), "user1");
        assertEquals(TokenAmount.of(2_000_000_000L), claimed);
        assertEquals(before.add(claimed), service.balance("user1"));
        assertEquals(TokenAmount.ZERO, service.getPendingWinnings("user1"));
        assertEquals(TokenAmount.ZERO, service.claimWinnings(as("user1"), "user1"));

        List<Object> events = fixture.sink.events();
        assertInstanceOf(RoundCreatedEvent.class, events.get(0));
        RoundResolvedEvent resolved = (RoundResolvedEvent) events.get(1);
        assertEquals(ResolutionOutcome.UP_WINS, resolved.outcome());
        assertEquals(BigInteger.valueOf(1_500_000), resolved.finalPrice());
    }

    @Test
    void precisionRound_tieSplitsPot_viaBothEntryPoints() {
        service.createRound(as(ADMIN), BigInteger.valueOf(21_600), 1);
        service.placePrecisionPrediction(as("user1"), "user1", TokenAmount.of(1_001), 21_595);
        service.predictPrice(as("user2"), "user2", 21_605, TokenAmount.of(1_000));

        List<PrecisionPrediction> predictions = service.getPrecisionPredictions();
        assertEquals(2, predictions.size());
        assertEquals(21_605, service.getUserPrecisionPrediction("user2").orElseThrow().getPredictedPrice());

        fixture.clock.advance(12);
        SettlementResult result = service.resolveRound(as(ORACLE), payload(21_600, 100));

        assertEquals(TokenAmount.of(1_000), service.getPendingWinnings("user1"));
        assertEquals(TokenAmount.of(1_000), service.getPendingWinnings("user2"));
        assertEquals(TokenAmount.of(1), result.getUndistributed());
        assertTrue(service.getPrecisionPredictions().isEmpty());
    }

    @Test
    void roundWithoutStakers_resolvesToEmptyPayout() {
        service.createRound(as(ADMIN), BigInteger.valueOf(1_000_000), 0);
        fixture.clock.advance(12);

        SettlementResult result = service.resolveRound(as(ORACLE), payload(900_000, 100));

        assertTrue(result.getPayouts().isEmpty());
        assertTrue(service.getActiveRound().isEmpty());
    }

    @Test
    void staking_shouldFollowWindows() {
        assertError(SettlementError.NO_ACTIVE_ROUND, () -> service.placeBet(as("user1"), "user1", STAKE, BetSide.UP));

        service.createRound(as(ADMIN), BigInteger.valueOf(1_000_000), null);
        fixture.clock.advance(5);
        service.placeBet(as("user1"), "user1", STAKE, BetSide.UP);

        fixture.clock.advance(1);
        assertError(SettlementError.ROUND_ENDED, () -> service.placeBet(as("user2"), "user2", STAKE, BetSide.DOWN));
        assertError(SettlementError.ROUND_NOT_ENDED, () -> service.resolveRound(as(ORACLE), payload(1_100_000, 100)));

        fixture.clock.advance(6);
        service.resolveRound(as(ORACLE), payload(1_100_000, 100));
        assertEquals(STAKE, service.getPendingWinnings("user1"));
    }

    @Test
    void staking_shouldValidateInput() {
        service.createRound(as(ADMIN), BigInteger.valueOf(1_000_000), null);

        assertError(SettlementError.INVALID_BET_AMOUNT, () -> service.placeBet(as("user1"), "user1", TokenAmount.ZERO, BetSide.UP));
        assertError(SettlementError.INVALID_BET_AMOUNT, () -> service.placeBet(as("user1"), "user1", TokenAmount.of(-1), BetSide.UP));
        assertError(SettlementError.UNAUTHORIZED_USER, () -> service.placeBet(as("user2"), "user1", STAKE, BetSide.UP));
        assertError(SettlementError.WRONG_MODE_FOR_PREDICTION,
                () -> service.placePrecisionPrediction(as("user1"), "user1", STAKE, 10_000));
        assertError(SettlementError.INSUFFICIENT_BALANCE,
                () -> service.placeBet(as("user3"), "user3", STAKE, BetSide.UP));

        service.placeBet(as("user1"), "user1", STAKE, BetSide.UP);
        assertError(SettlementError.ALREADY_BET, () -> service.placeBet(as("user1"), "user1", STAKE, BetSide.UP));
        assertEquals(STAKE, service.getActiveRound().orElseThrow().getPoolUp());
    }

    @Test
    void failedInvocation_shouldLeaveNoTrace() {
        service.createRound(as(ADMIN), BigInteger.valueOf(1_000_000), null);
        TokenAmount before = service.balance("user1");

        service.placeBet(as("user1"), "user1", STAKE, BetSide.UP);
        assertError(SettlementError.ALREADY_BET, () -> service.placeBet(as("user1"), "user1", STAKE, BetSide.DOWN));

        assertEquals(before.subtract(STAKE), service.balance("user1"));
        assertEquals(TokenAmount.ZERO, service.getActiveRound().orElseThrow().getPoolDown());
    }

    @Test
    void admin_shouldGateRoundsAndWindows() {
        assertError(SettlementError.UNAUTHORIZED_ADMIN, () -> service.createRound(as("user1"), BigInteger.ONE, null));
        assertError(SettlementError.UNAUTHORIZED_ADMIN, () -> service.setWindows(as(ORACLE), 3, 9));
        assertError(SettlementError.INVALID_PRICE, () -> service.createRound(as(ADMIN), BigInteger.ZERO, null));
        assertError(SettlementError.INVALID_MODE, () -> service.createRound(as(ADMIN), BigInteger.ONE, 2));
        assertError(SettlementError.INVALID_PRICE, () -> service.createRound(as(ADMIN), BigInteger.ZERO, 5));
        assertError(SettlementError.ALREADY_INITIALIZED, () -> service.initialize(as(ADMIN), ADMIN, ORACLE));

        assertEquals(new WindowConfig(6, 12), service.getWindows());
        service.setWindows(as(ADMIN), 3, 9);
        Round round = service.createRound(as(ADMIN), BigInteger.ONE, null);
        assertEquals(round.getStartLedger() + 3, round.getBetEndLedger());
        assertEquals(round.getStartLedger() + 9, round.getEndLedger());
        assertError(SettlementError.ROUND_ALREADY_ACTIVE, () -> service.createRound(as(ADMIN), BigInteger.ONE, null));

        assertEquals(ADMIN, service.getAdmin().orElseThrow());
        assertEquals(ORACLE, service.getOracle().orElseThrow());
    }

    @Test
    void resolve_shouldRequireOracleAndMatchingFreshPayload() {
        service.createRound(as(ADMIN), BigInteger.valueOf(1_000_000), null);
        fixture.clock.advance(12);

        assertError(SettlementError.UNAUTHORIZED_ORACLE, () -> service.resolveRound(as(ADMIN), payload(1, 100)));
        assertError(SettlementError.INVALID_ORACLE_ROUND, () -> service.resolveRound(as(ORACLE), payload(1, 101)));
        assertError(SettlementError.STALE_ORACLE_DATA, () -> service.resolveRound(as(ORACLE),
                OraclePayload.builder().price(BigInteger.ONE).timestamp(fixture.clock.timestamp() - 301).roundId(100).build()));
        assertError(SettlementError.INVALID_PRICE, () -> service.resolveRound(as(ORACLE), payload(0, 100)));

        service.resolveRound(as(ORACLE), payload(1, 100));
        assertError(SettlementError.NO_ACTIVE_ROUND, () -> service.resolveRound(as(ORACLE), payload(1, 100)));
    }

    @Test
    void roundNumbers_shouldIncreaseAcrossModes() {
        assertEquals(0, service.getLastRoundId());

        service.createRound(as(ADMIN), BigInteger.TEN, 0);
        fixture.clock.advance(12);
        service.resolveRound(as(ORACLE), payload(10, 100));
        Round second = service.createRound(as(ADMIN), BigInteger.TEN, 1);

        assertEquals(2, second.getRoundNumber());
        assertEquals(2, service.getLastRoundId());
    }

    @Test
    void mintInitial_shouldBeIdempotent() {
        TokenAmount first = service.balance("user1");

        assertEquals(first, service.mintInitial(as("user1"), "user1"));
        assertEquals(ContractFixture.INITIAL_MINT, service.balance("user1"));
    }

    private OraclePayload payload(long price, long roundId) {
        return OraclePayload.builder()
                .price(BigInteger.valueOf(price))
                .timestamp(fixture.clock.timestamp())
                .roundId(roundId)
                .build();
    }

    private static void assertError(SettlementError expected, Runnable call) {
        SettlementException e = assertThrows(SettlementException.class, call::run);
        assertEquals(expected, e.getError());
    }
}
