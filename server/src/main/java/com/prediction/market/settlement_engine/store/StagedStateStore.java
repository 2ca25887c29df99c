package com.prediction.market.settlement_engine.store;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

/**
 * Write overlay for a single invocation.
 *
 * Reads see the invocation's own writes first, then the backing store. Nothing reaches
 * the backing store until {@link #commit()}; an invocation that fails simply drops the
 * overlay.
 */
@Slf4j
public class StagedStateStore implements StateStore {

    private final StateStore backing;
    private final Map<DataKey, Object> puts = new LinkedHashMap<>();
    private final Set<DataKey> removals = new LinkedHashSet<>();
    private boolean committed;

    public StagedStateStore(StateStore backing) {
        this.backing = backing;
    }

    @Override
    public <T> Optional<T> get(DataKey key, Class<T> type) {
        if (removals.contains(key)) {
            return Optional.empty();
        }
        Object staged = puts.get(key);
        if (staged != null) {
            return Optional.of(type.cast(staged));
        }
        return backing.get(key, type);
    }

    @Override
    public boolean has(DataKey key) {
        if (removals.contains(key)) {
            return false;
        }
        return puts.containsKey(key) || backing.has(key);
    }

    @Override
    public void put(DataKey key, Object value) {
        ensureOpen();
        if (value == null) {
            throw new IllegalArgumentException("Null value for key " + key);
        }
        removals.remove(key);
        puts.put(key, value);
    }

    @Override
    public void remove(DataKey key) {
        ensureOpen();
        puts.remove(key);
        removals.add(key);
    }

    public boolean isDirty() {
        return !puts.isEmpty() || !removals.isEmpty();
    }

    /**
     * Push every staged write to the backing store. May be called once.
     */
    public void commit() {
        ensureOpen();
        committed = true;
        if (!isDirty()) {
            return;
        }
        backing.apply(puts, removals);
        log.debug("Committed {} writes and {} removals", puts.size(), removals.size());
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Staged store already committed");
        }
    }
}
