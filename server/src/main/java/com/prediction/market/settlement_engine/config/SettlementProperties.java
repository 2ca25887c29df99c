package com.prediction.market.settlement_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.prediction.market.settlement_engine.entity.WindowConfig;

import lombok.Getter;
import lombok.Setter;

/**
 * Engine settings bound from {@code settlement.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    /** Betting window in ledgers, used until the admin configures one. */
    private long defaultBetWindow = 6;

    /** Run window in ledgers, used until the admin configures one. */
    private long defaultRunWindow = 12;

    /** Starting balance in base units (1000 tokens at 7 decimals). */
    private String initialMint = "10000000000";

    private long oracleMaxAgeSeconds = 300;

    private Ledger ledger = new Ledger();

    private Store store = new Store();

    public WindowConfig defaultWindows() {
        WindowConfig windows = new WindowConfig(defaultBetWindow, defaultRunWindow);
        if (!windows.isValid()) {
            throw new IllegalStateException(String.format(
                    "settlement.default-bet-window (%d) must be positive and below settlement.default-run-window (%d)",
                    defaultBetWindow, defaultRunWindow));
        }
        return windows;
    }

    @Getter
    @Setter
    public static class Ledger {
        private long closeSeconds = 5;
        private long genesisEpochSecond = 0;
    }

    @Getter
    @Setter
    public static class Store {
        /** {@code memory} or {@code mongo}. */
        private String type = "memory";
    }
}
