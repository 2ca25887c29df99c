package com.prediction.market.settlement_engine.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * An exact-price guess in a precision round. {@code predictedPrice} is scaled by 10,000.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class PrecisionPrediction {
    private String user;
    private TokenAmount amount;
    private long predictedPrice;
}
