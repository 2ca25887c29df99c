package com.prediction.market.settlement_engine.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.settlement_engine.engine.PayoutCalculator;
import com.prediction.market.settlement_engine.engine.PredictionMarketContract;
import com.prediction.market.settlement_engine.engine.RoundLifecycle;
import com.prediction.market.settlement_engine.engine.SettlementEngine;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.events.ApplicationEventSink;
import com.prediction.market.settlement_engine.events.SettlementEventSink;
import com.prediction.market.settlement_engine.execution.ContractExecutor;
import com.prediction.market.settlement_engine.ledger.LedgerClock;
import com.prediction.market.settlement_engine.ledger.SystemLedgerClock;
import com.prediction.market.settlement_engine.repositories.StateEntryRepository;
import com.prediction.market.settlement_engine.security.AccessController;
import com.prediction.market.settlement_engine.service.BalanceLedger;
import com.prediction.market.settlement_engine.service.OracleValidator;
import com.prediction.market.settlement_engine.service.PendingWinningsVault;
import com.prediction.market.settlement_engine.service.PositionBook;
import com.prediction.market.settlement_engine.service.PredictionMarketService;
import com.prediction.market.settlement_engine.service.StatsTracker;
import com.prediction.market.settlement_engine.service.WindowPolicy;
import com.prediction.market.settlement_engine.store.InMemoryStateStore;
import com.prediction.market.settlement_engine.store.MongoStateStore;
import com.prediction.market.settlement_engine.store.StateStore;

@Configuration
public class SettlementConfig {

    @Bean
    @ConditionalOnProperty(prefix = "settlement.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public StateStore inMemoryStateStore() {
        return new InMemoryStateStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "settlement.store", name = "type", havingValue = "mongo")
    public StateStore mongoStateStore(StateEntryRepository stateEntryRepository) {
        return new MongoStateStore(stateEntryRepository);
    }

    @Bean
    public LedgerClock ledgerClock(SettlementProperties properties) {
        return new SystemLedgerClock(Clock.systemUTC(),
                properties.getLedger().getCloseSeconds(),
                properties.getLedger().getGenesisEpochSecond());
    }

    @Bean
    public SettlementEventSink settlementEventSink(ApplicationEventPublisher applicationEventPublisher) {
        return new ApplicationEventSink(applicationEventPublisher);
    }

    @Bean
    public ContractExecutor contractExecutor(StateStore stateStore, LedgerClock ledgerClock, SettlementEventSink settlementEventSink) {
        return new ContractExecutor(stateStore, ledgerClock, settlementEventSink);
    }

    @Bean
    public AccessController accessController() {
        return new AccessController();
    }

    @Bean
    public BalanceLedger balanceLedger(SettlementProperties properties) {
        return new BalanceLedger(TokenAmount.of(properties.getInitialMint()));
    }

    @Bean
    public PendingWinningsVault pendingWinningsVault(BalanceLedger balanceLedger) {
        return new PendingWinningsVault(balanceLedger);
    }

    @Bean
    public StatsTracker statsTracker() {
        return new StatsTracker();
    }

    @Bean
    public WindowPolicy windowPolicy(SettlementProperties properties) {
        return new WindowPolicy(properties.defaultWindows());
    }

    @Bean
    public PositionBook positionBook(BalanceLedger balanceLedger) {
        return new PositionBook(balanceLedger);
    }

    @Bean
    public OracleValidator oracleValidator(SettlementProperties properties) {
        return new OracleValidator(properties.getOracleMaxAgeSeconds());
    }

    @Bean
    PayoutCalculator payoutCalculator() {
        return new PayoutCalculator();
    }

    @Bean
    public RoundLifecycle roundLifecycle(WindowPolicy windowPolicy, PositionBook positionBook) {
        return new RoundLifecycle(windowPolicy, positionBook);
    }

    @Bean
    public SettlementEngine settlementEngine(RoundLifecycle roundLifecycle, PositionBook positionBook,
            OracleValidator oracleValidator, PendingWinningsVault pendingWinningsVault,
            StatsTracker statsTracker, PayoutCalculator payoutCalculator) {
        return new SettlementEngine(roundLifecycle, positionBook, oracleValidator, pendingWinningsVault,
                statsTracker, payoutCalculator);
    }

    @Bean
    public PredictionMarketContract predictionMarketContract(AccessController accessController,
            WindowPolicy windowPolicy, RoundLifecycle roundLifecycle, PositionBook positionBook,
            SettlementEngine settlementEngine, PendingWinningsVault pendingWinningsVault,
            BalanceLedger balanceLedger, StatsTracker statsTracker) {
        return new PredictionMarketContract(accessController, windowPolicy, roundLifecycle, positionBook,
                settlementEngine, pendingWinningsVault, balanceLedger, statsTracker);
    }

    @Bean
    public PredictionMarketService predictionMarketService(ContractExecutor contractExecutor,
            PredictionMarketContract predictionMarketContract) {
        return new PredictionMarketService(contractExecutor, predictionMarketContract);
    }
}
