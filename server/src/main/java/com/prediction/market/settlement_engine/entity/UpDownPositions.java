package com.prediction.market.settlement_engine.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Up/Down sub-ledger of the active round: one position per user, in staking order.
 * Copy-on-write; {@link #with} never touches the receiver.
 *
 * Kept as a list rather than a map so user ids are never used as document keys.
 */
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UpDownPositions {

    private ArrayList<UserPositionEntry> entries = new ArrayList<>();

    private UpDownPositions(ArrayList<UserPositionEntry> entries) {
        this.entries = entries;
    }

    public static UpDownPositions empty() {
        return new UpDownPositions(new ArrayList<>());
    }

    public boolean contains(String user) {
        return get(user).isPresent();
    }

    public Optional<UserPosition> get(String user) {
        return entries.stream()
                .filter(e -> e.getUser().equals(user))
                .map(UserPositionEntry::getPosition)
                .findFirst();
    }

    /**
     * Returns a copy with {@code user}'s position set, replacing any previous one.
     */
    public UpDownPositions with(String user, UserPosition position) {
        ArrayList<UserPositionEntry> copy = new ArrayList<>(entries);
        UserPositionEntry entry = new UserPositionEntry(user, position);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).getUser().equals(user)) {
                copy.set(i, entry);
                return new UpDownPositions(copy);
            }
        }
        copy.add(entry);
        return new UpDownPositions(copy);
    }

    public Map<String, UserPosition> asMap() {
        LinkedHashMap<String, UserPosition> map = new LinkedHashMap<>();
        for (UserPositionEntry entry : entries) {
            map.put(entry.getUser(), entry.getPosition());
        }
        return Collections.unmodifiableMap(map);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    public static class UserPositionEntry {
        private String user;
        private UserPosition position;
    }
}
