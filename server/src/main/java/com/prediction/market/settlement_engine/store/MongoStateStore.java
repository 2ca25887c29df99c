package com.prediction.market.settlement_engine.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.transaction.annotation.Transactional;

import com.prediction.market.settlement_engine.entity.StateEntry;
import com.prediction.market.settlement_engine.repositories.StateEntryRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Store backed by the {@code contract_state} collection, one document per key.
 *
 * {@link #apply} runs in a MongoDB transaction, so a staged commit lands entirely or not
 * at all. Transactions need a replica set or sharded cluster.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoStateStore implements StateStore {

    private final StateEntryRepository stateEntryRepository;

    @Override
    public <T> Optional<T> get(DataKey key, Class<T> type) {
        return stateEntryRepository.findById(key.storageId())
                .map(StateEntry::getValue)
                .map(type::cast);
    }

    @Override
    public boolean has(DataKey key) {
        return stateEntryRepository.existsById(key.storageId());
    }

    @Override
    public void put(DataKey key, Object value) {
        stateEntryRepository.save(toEntry(key, value, System.currentTimeMillis()));
    }

    @Override
    public void remove(DataKey key) {
        stateEntryRepository.deleteById(key.storageId());
    }

    @Override
    @Transactional
    public void apply(Map<DataKey, Object> puts, Collection<DataKey> removals) {
        long now = System.currentTimeMillis();
        List<StateEntry> entries = new ArrayList<>(puts.size());
        puts.forEach((key, value) -> entries.add(toEntry(key, value, now)));

        try {
            if (!entries.isEmpty()) {
                stateEntryRepository.saveAll(entries);
            }
            if (!removals.isEmpty()) {
                stateEntryRepository.deleteAllById(removals.stream().map(DataKey::storageId).toList());
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist contract state: {} puts, {} removals", entries.size(), removals.size(), e);
            throw e;
        }
    }

    private static StateEntry toEntry(DataKey key, Object value, long timestamp) {
        return StateEntry.builder()
                .id(key.storageId())
                .namespace(key.getNamespace().name())
                .user(key.getUser())
                .value(value)
                .updatedAt(timestamp)
                .build();
    }
}
