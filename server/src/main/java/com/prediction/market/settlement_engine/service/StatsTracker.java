package com.prediction.market.settlement_engine.service;

import com.prediction.market.settlement_engine.entity.UserStats;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.store.DataKey;

public class StatsTracker {

    public UserStats stats(InvocationContext ctx, String user) {
        return ctx.store().get(DataKey.userStats(user), UserStats.class).orElseGet(UserStats::empty);
    }

    public UserStats recordWin(InvocationContext ctx, String user) {
        UserStats updated = stats(ctx, user).recordWin();
        ctx.store().put(DataKey.userStats(user), updated);
        return updated;
    }

    public UserStats recordLoss(InvocationContext ctx, String user) {
        UserStats updated = stats(ctx, user).recordLoss();
        ctx.store().put(DataKey.userStats(user), updated);
        return updated;
    }
}
