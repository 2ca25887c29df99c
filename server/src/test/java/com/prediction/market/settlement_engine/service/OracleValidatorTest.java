package com.prediction.market.settlement_engine.service;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import com.prediction.market.settlement_engine.entity.OraclePayload;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;

import static org.junit.jupiter.api.Assertions.*;

class OracleValidatorTest {

    private static final long NOW = 10_000;

    private final OracleValidator validator = new OracleValidator(300);

    private final Round round = Round.builder()
            .mode(RoundMode.UP_DOWN)
            .roundNumber(1)
            .startLedger(42)
            .betEndLedger(48)
            .endLedger(54)
            .priceStart(BigInteger.valueOf(1_000_000))
            .build();

    @Test
    void validate_shouldAcceptFreshPayloadForActiveRound() {
        assertDoesNotThrow(() -> validator.validate(payload(1, NOW - 300, 42), round, NOW));
    }

    @Test
    void validate_shouldRejectZeroPrice() {
        assertError(SettlementError.INVALID_PRICE, payload(0, NOW, 42));
    }

    @Test
    void validate_shouldRejectPayloadForAnotherRound() {
        assertError(SettlementError.INVALID_ORACLE_ROUND, payload(1_500_000, NOW, 41));
    }

    @Test
    void validate_shouldRejectStalePayload() {
        assertError(SettlementError.STALE_ORACLE_DATA, payload(1_500_000, NOW - 301, 42));
    }

    @Test
    void validate_shouldAcceptPayloadFromTheFuture() {
        assertDoesNotThrow(() -> validator.validate(payload(1_500_000, NOW + 60, 42), round, NOW));
    }

    @Test
    void validate_shouldReportOverflow_whenTimestampNearLongMax() {
        assertError(SettlementError.OVERFLOW, OraclePayload.builder()
                .price(BigInteger.ONE)
                .timestamp(Long.MAX_VALUE)
                .roundId(42)
                .build());
    }

    private static OraclePayload payload(long price, long timestamp, long roundId) {
        return new OraclePayload(BigInteger.valueOf(price), timestamp, roundId);
    }

    private void assertError(SettlementError expected, OraclePayload payload) {
        SettlementException e = assertThrows(SettlementException.class, () -> validator.validate(payload, round, NOW));
        assertEquals(expected, e.getError());
    }
}
