package com.prediction.market.settlement_engine.service;

import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.store.DataKey;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Claimable amounts produced by settlement. Kept apart from {@link BalanceLedger}
 * until the user pulls them with {@link #claim}.
 */
@Slf4j
@RequiredArgsConstructor
public class PendingWinningsVault {

    private final BalanceLedger balanceLedger;

    public TokenAmount pending(InvocationContext ctx, String user) {
        return ctx.store().get(DataKey.pendingWinnings(user), TokenAmount.class).orElse(TokenAmount.ZERO);
    }

    public TokenAmount accrue(InvocationContext ctx, String user, TokenAmount amount) {
        TokenAmount updated = pending(ctx, user).add(amount);
        ctx.store().put(DataKey.pendingWinnings(user), updated);
        return updated;
    }

    /**
     * Move everything pending into the user's balance.
     *
     * @return the amount moved, zero when nothing was pending
     */
    public TokenAmount claim(InvocationContext ctx, String user) {
        TokenAmount pending = pending(ctx, user);
        if (pending.isZero()) {
            return TokenAmount.ZERO;
        }

        ctx.store().remove(DataKey.pendingWinnings(user));
        TokenAmount balance = balanceLedger.credit(ctx, user, pending);
        log.info("User {} claimed {} (balance now {})", user, pending, balance);
        return pending;
    }
}
