package com.prediction.market.settlement_engine;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.prediction.market.settlement_engine.repositories.StateEntryRepository;
import com.prediction.market.settlement_engine.store.StateNamespace;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "settlement.store", name = "type", havingValue = "mongo")
public class MongoStartUpCheck {

    private final StateEntryRepository stateEntryRepository;

    @PostConstruct
    public void checkMongoConnection() {
        try {
            long entries = stateEntryRepository.count();
            boolean initialized = !stateEntryRepository.findByNamespace(StateNamespace.ADMIN.name()).isEmpty();
            log.info("MongoDB connection successful: {} state entries, contract {}",
                    entries, initialized ? "initialized" : "not initialized");
        } catch (RuntimeException e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
