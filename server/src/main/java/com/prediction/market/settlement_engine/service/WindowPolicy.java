package com.prediction.market.settlement_engine.service;

import com.prediction.market.settlement_engine.entity.WindowConfig;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.store.DataKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Betting and run window lengths, and the round markers derived from them.
 *
 * Ledger sequence numbers are unsigned 32-bit; marker arithmetic that would leave that
 * range fails with {@link SettlementError#OVERFLOW}.
 */
@Slf4j
public class WindowPolicy {

    static final long MAX_LEDGER = 0xFFFF_FFFFL;

    private final WindowConfig defaults;

    public WindowPolicy(WindowConfig defaults) {
        if (!defaults.isValid()) {
            throw new IllegalStateException("Invalid default windows: " + defaults);
        }
        this.defaults = defaults;
    }

    public WindowConfig currentWindows(InvocationContext ctx) {
        return ctx.store().get(DataKey.windowConfig(), WindowConfig.class).orElse(defaults);
    }

    public WindowConfig setWindows(InvocationContext ctx, long betLedgers, long runLedgers) {
        if (betLedgers <= 0 || runLedgers <= 0 || betLedgers > MAX_LEDGER || runLedgers > MAX_LEDGER) {
            throw new SettlementException(SettlementError.INVALID_DURATION, "window lengths must be positive");
        }
        if (betLedgers >= runLedgers) {
            throw new SettlementException(SettlementError.INVALID_DURATION, "bet window must end before run window");
        }

        WindowConfig windows = new WindowConfig(betLedgers, runLedgers);
        ctx.store().put(DataKey.windowConfig(), windows);
        log.info("Windows updated: bet={} run={}", betLedgers, runLedgers);
        return windows;
    }

    public long betEndLedger(WindowConfig windows, long startLedger) {
        return addLedgers(startLedger, windows.getBetLedgers());
    }

    public long endLedger(WindowConfig windows, long startLedger) {
        return addLedgers(startLedger, windows.getRunLedgers());
    }

    private static long addLedgers(long start, long length) {
        long end = start + length;
        if (end > MAX_LEDGER || end < start) {
            throw new SettlementException(SettlementError.OVERFLOW, "ledger marker");
        }
        return end;
    }
}
