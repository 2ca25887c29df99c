package com.prediction.market.settlement_engine.entity;

import java.math.BigInteger;
import java.util.Objects;

import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;

/**
 * Signed 128-bit token amount in base units (7 implied decimals).
 *
 * Every arithmetic operation is checked against the signed 128-bit range and fails
 * with {@link SettlementError#OVERFLOW} instead of wrapping.
 *
 * Immutable and thread-safe.
 */
public final class TokenAmount implements Comparable<TokenAmount> {

    public static final BigInteger MIN_VALUE = BigInteger.ONE.shiftLeft(127).negate();
    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

    public static final TokenAmount ZERO = new TokenAmount(BigInteger.ZERO);

    private final BigInteger amount;

    private TokenAmount(BigInteger amount) {
        this.amount = amount;
    }

    /**
     * Create an amount from a wide integer, rejecting values outside the 128-bit range.
     */
    public static TokenAmount of(BigInteger amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new TokenAmount(checked(amount));
    }

    public static TokenAmount of(long amount) {
        return new TokenAmount(BigInteger.valueOf(amount));
    }

    /**
     * Create an amount from its decimal string form (base units, no fraction).
     */
    public static TokenAmount of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return of(new BigInteger(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    public TokenAmount add(TokenAmount other) {
        return new TokenAmount(checked(this.amount.add(other.amount)));
    }

    public TokenAmount subtract(TokenAmount other) {
        return new TokenAmount(checked(this.amount.subtract(other.amount)));
    }

    public TokenAmount multiply(TokenAmount other) {
        return new TokenAmount(checked(this.amount.multiply(other.amount)));
    }

    /**
     * Truncating integer division. Callers guarantee a non-zero divisor.
     */
    public TokenAmount divide(TokenAmount divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return new TokenAmount(checked(this.amount.divide(divisor.amount)));
    }

    public TokenAmount divide(long divisor) {
        return divide(TokenAmount.of(divisor));
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isGreaterThanOrEqualTo(TokenAmount other) {
        return this.compareTo(other) >= 0;
    }

    public boolean isLessThan(TokenAmount other) {
        return this.compareTo(other) < 0;
    }

    public BigInteger toBigInteger() {
        return amount;
    }

    private static BigInteger checked(BigInteger value) {
        if (value.compareTo(MIN_VALUE) < 0 || value.compareTo(MAX_VALUE) > 0) {
            throw new SettlementException(SettlementError.OVERFLOW, "amount outside 128-bit range");
        }
        return value;
    }

    @Override
    public int compareTo(TokenAmount other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        TokenAmount that = (TokenAmount) obj;
        return amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return amount.toString();
    }
}
