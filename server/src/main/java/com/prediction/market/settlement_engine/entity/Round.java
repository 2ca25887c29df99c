package com.prediction.market.settlement_engine.entity;

import java.math.BigInteger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * The single active round.
 *
 * Markers are ledger sequence numbers: staking is open while
 * {@code now < betEndLedger}, resolution is allowed once {@code now >= endLedger}.
 * The start marker doubles as the oracle correlation id.
 *
 * Instances are never mutated in place; use {@link #toBuilder()} to derive a new one.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // required by Spring Data
@AllArgsConstructor
@Builder(toBuilder = true)
public class Round {
    private RoundMode mode;
    private long roundNumber; // 1-based, increments across modes
    private long startLedger;
    private long betEndLedger;
    private long endLedger;
    private BigInteger priceStart;

    @Builder.Default
    private TokenAmount poolUp = TokenAmount.ZERO;

    @Builder.Default
    private TokenAmount poolDown = TokenAmount.ZERO;

    /**
     * Identifier the oracle must echo back when resolving this round.
     */
    public long getRoundId() {
        return startLedger;
    }

    public TokenAmount poolFor(BetSide side) {
        return side == BetSide.UP ? poolUp : poolDown;
    }

    /**
     * Returns a copy with {@code amount} added to the pool of {@code side}, checked for overflow.
     */
    public Round withStake(BetSide side, TokenAmount amount) {
        if (side == BetSide.UP) {
            return toBuilder().poolUp(poolUp.add(amount)).build();
        }
        return toBuilder().poolDown(poolDown.add(amount)).build();
    }
}
