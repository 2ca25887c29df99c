package com.prediction.market.settlement_engine.store;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Address of one value in the {@link StateStore}. Construct through the static factories,
 * which fix the set of valid keys.
 */
@Getter
@EqualsAndHashCode
public final class DataKey {

    private final StateNamespace namespace;
    private final String user;

    private DataKey(StateNamespace namespace, String user) {
        if (namespace.isPerUser() && (user == null || user.isEmpty())) {
            throw new IllegalArgumentException(namespace + " key requires a user");
        }
        if (!namespace.isPerUser() && user != null) {
            throw new IllegalArgumentException(namespace + " key is not per-user");
        }
        this.namespace = namespace;
        this.user = user;
    }

    public static DataKey balance(String user) {
        return new DataKey(StateNamespace.BALANCE, user);
    }

    public static DataKey admin() {
        return new DataKey(StateNamespace.ADMIN, null);
    }

    public static DataKey oracle() {
        return new DataKey(StateNamespace.ORACLE, null);
    }

    public static DataKey activeRound() {
        return new DataKey(StateNamespace.ACTIVE_ROUND, null);
    }

    public static DataKey upDownPositions() {
        return new DataKey(StateNamespace.UPDOWN_POSITIONS, null);
    }

    public static DataKey precisionPositions() {
        return new DataKey(StateNamespace.PRECISION_POSITIONS, null);
    }

    public static DataKey pendingWinnings(String user) {
        return new DataKey(StateNamespace.PENDING_WINNINGS, user);
    }

    public static DataKey userStats(String user) {
        return new DataKey(StateNamespace.USER_STATS, user);
    }

    public static DataKey windowConfig() {
        return new DataKey(StateNamespace.WINDOW_CONFIG, null);
    }

    public static DataKey lastRoundId() {
        return new DataKey(StateNamespace.LAST_ROUND_ID, null);
    }

    /**
     * Flat identifier used by persistent backends, e.g. {@code BALANCE:alice} or {@code ADMIN}.
     */
    public String storageId() {
        return user == null ? namespace.name() : namespace.name() + ":" + user;
    }

    @Override
    public String toString() {
        return storageId();
    }
}
