package com.prediction.market.settlement_engine.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-local store. State lives as long as the owning host.
 */
@Slf4j
public class InMemoryStateStore implements StateStore {

    private final ConcurrentHashMap<DataKey, Object> entries = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(DataKey key, Class<T> type) {
        Object value = entries.get(key);
        return value == null ? Optional.empty() : Optional.of(type.cast(value));
    }

    @Override
    public boolean has(DataKey key) {
        return entries.containsKey(key);
    }

    @Override
    public void put(DataKey key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Null value for key " + key);
        }
        entries.put(key, value);
        log.trace("Stored {}", key);
    }

    @Override
    public void remove(DataKey key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
