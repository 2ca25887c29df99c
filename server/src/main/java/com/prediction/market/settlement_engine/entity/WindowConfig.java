package com.prediction.market.settlement_engine.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Betting and run window lengths, in ledgers. Invariant: {@code 0 < betLedgers < runLedgers}.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class WindowConfig {
    private long betLedgers;
    private long runLedgers;

    public boolean isValid() {
        return betLedgers > 0 && runLedgers > 0 && betLedgers < runLedgers;
    }
}
