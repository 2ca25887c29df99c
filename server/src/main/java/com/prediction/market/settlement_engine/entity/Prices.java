package com.prediction.market.settlement_engine.entity;

import java.math.BigInteger;

import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;

/**
 * Price constants and range checks.
 *
 * Prices are unsigned 128-bit integers. Precision-mode prices are scaled by 10,000
 * (4 decimal digits) and must lie in [1, 999_999].
 */
public final class Prices {

    public static final BigInteger U128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public static final long MIN_PRECISION_PRICE = 1L;
    public static final long MAX_PRECISION_PRICE = 999_999L;

    private Prices() {
    }

    /**
     * Reject zero, negative, or wider-than-128-bit prices.
     */
    public static BigInteger requireValidPrice(BigInteger price) {
        if (price == null || price.signum() <= 0) {
            throw new SettlementException(SettlementError.INVALID_PRICE);
        }
        if (price.compareTo(U128_MAX) > 0) {
            throw new SettlementException(SettlementError.OVERFLOW, "price outside unsigned 128-bit range");
        }
        return price;
    }

    public static boolean isValidPrecisionPrice(long predictedPrice) {
        return predictedPrice >= MIN_PRECISION_PRICE && predictedPrice <= MAX_PRECISION_PRICE;
    }
}
