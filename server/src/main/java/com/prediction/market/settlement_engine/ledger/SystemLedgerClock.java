package com.prediction.market.settlement_engine.ledger;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives the ledger sequence from wall-clock time: one ledger every
 * {@code closeSeconds}, counted from {@code genesisEpochSecond}.
 *
 * Never goes backwards: if the wall clock is stepped back, the highest sequence and
 * timestamp already issued are returned until real time catches up.
 */
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private final long closeSeconds;
    private final long genesisEpochSecond;

    private final AtomicLong lastSequence = new AtomicLong();
    private final AtomicLong lastTimestamp = new AtomicLong();

    public SystemLedgerClock(Clock clock, long closeSeconds, long genesisEpochSecond) {
        if (closeSeconds <= 0) {
            throw new IllegalArgumentException("Ledger close time must be positive");
        }
        this.clock = clock;
        this.closeSeconds = closeSeconds;
        this.genesisEpochSecond = genesisEpochSecond;
    }

    @Override
    public LedgerInfo current() {
        long now = Math.max(0, clock.instant().getEpochSecond());
        long elapsed = Math.max(0, now - genesisEpochSecond);
        long sequence = lastSequence.accumulateAndGet(elapsed / closeSeconds, Math::max);
        long timestamp = lastTimestamp.accumulateAndGet(now, Math::max);
        return new LedgerInfo(sequence, timestamp);
    }
}
