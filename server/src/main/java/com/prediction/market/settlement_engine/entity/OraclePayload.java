package com.prediction.market.settlement_engine.entity;

import java.math.BigInteger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Price observation submitted by the oracle to resolve the active round.
 *
 * {@code timestamp} is in ledger-clock seconds; {@code roundId} must equal the
 * active round's start ledger.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
public class OraclePayload {
    private final BigInteger price;
    private final long timestamp;
    private final long roundId;
}
