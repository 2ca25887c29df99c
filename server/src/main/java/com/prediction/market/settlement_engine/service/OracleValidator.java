package com.prediction.market.settlement_engine.service;

import com.prediction.market.settlement_engine.entity.OraclePayload;
import com.prediction.market.settlement_engine.entity.Prices;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;

import lombok.extern.slf4j.Slf4j;

/**
 * Gate for oracle payloads.
 *
 * A payload is accepted only if its price is non-zero, it names the active round,
 * and it is no older than the freshness window at the time of resolution.
 * Validation is read-only.
 */
@Slf4j
public class OracleValidator {

    private final long maxAgeSeconds;

    public OracleValidator(long maxAgeSeconds) {
        if (maxAgeSeconds < 0) {
            throw new IllegalStateException("Oracle max age must not be negative");
        }
        this.maxAgeSeconds = maxAgeSeconds;
    }

    /**
     * Validate a payload against the round it claims to resolve.
     *
     * @param payload the oracle observation
     * @param round the active round
     * @param now current ledger timestamp
     */
    public void validate(OraclePayload payload, Round round, long now) {
        // 1. Price
        Prices.requireValidPrice(payload.getPrice());

        // 2. Round correlation
        if (payload.getRoundId() != round.getRoundId()) {
            log.warn("Oracle payload for round {} rejected, active round is {}", payload.getRoundId(), round.getRoundId());
            throw new SettlementException(SettlementError.INVALID_ORACLE_ROUND,
                    String.format("payload round %d, active round %d", payload.getRoundId(), round.getRoundId()));
        }

        // 3. Freshness
        long expiresAt;
        try {
            expiresAt = Math.addExact(payload.getTimestamp(), maxAgeSeconds);
        } catch (ArithmeticException e) {
            throw new SettlementException(SettlementError.OVERFLOW, "oracle timestamp");
        }
        if (now > expiresAt) {
            log.warn("Stale oracle payload: timestamp={}, now={}, maxAge={}", payload.getTimestamp(), now, maxAgeSeconds);
            throw new SettlementException(SettlementError.STALE_ORACLE_DATA,
                    String.format("observed at %d, now %d", payload.getTimestamp(), now));
        }
    }
}
