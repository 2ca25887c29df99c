package com.prediction.market.settlement_engine.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;

/**
 * Per-user win/loss record. Persists across rounds; counters only move forward,
 * except {@code currentStreak} which resets on a loss.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class UserStats {

    private static final long U32_MAX = 0xFFFF_FFFFL;

    private long totalWins;
    private long totalLosses;
    private long currentStreak;
    private long bestStreak;

    public static UserStats empty() {
        return new UserStats(0, 0, 0, 0);
    }

    public UserStats recordWin() {
        long streak = increment(currentStreak);
        return toBuilder()
                .totalWins(increment(totalWins))
                .currentStreak(streak)
                .bestStreak(Math.max(bestStreak, streak))
                .build();
    }

    public UserStats recordLoss() {
        return toBuilder()
                .totalLosses(increment(totalLosses))
                .currentStreak(0)
                .build();
    }

    private static long increment(long counter) {
        if (counter >= U32_MAX) {
            throw new SettlementException(SettlementError.OVERFLOW, "stats counter");
        }
        return counter + 1;
    }
}
