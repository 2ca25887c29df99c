package com.prediction.market.settlement_engine.store;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value contract the engine needs from its host.
 *
 * Stored values are treated as immutable: callers replace a value with {@link #put}
 * instead of mutating what {@link #get} returned.
 */
public interface StateStore {

    <T> Optional<T> get(DataKey key, Class<T> type);

    boolean has(DataKey key);

    void put(DataKey key, Object value);

    void remove(DataKey key);

    /**
     * Apply a batch of writes. Backends that can write in bulk should override.
     *
     * @param puts values to store, in order
     * @param removals keys to delete
     */
    default void apply(Map<DataKey, Object> puts, Collection<DataKey> removals) {
        puts.forEach(this::put);
        removals.forEach(this::remove);
    }
}
