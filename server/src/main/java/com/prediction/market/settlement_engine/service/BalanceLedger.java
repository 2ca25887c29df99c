package com.prediction.market.settlement_engine.service;

import java.util.Optional;

import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.store.DataKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-user spendable balances.
 * Balances never go negative: debits are refused when the balance is short.
 */
@Slf4j
public class BalanceLedger {

    private final TokenAmount initialMint;

    public BalanceLedger(TokenAmount initialMint) {
        if (!initialMint.isPositive()) {
            throw new IllegalArgumentException("Initial mint must be positive");
        }
        this.initialMint = initialMint;
    }

    /**
     * @return the user's balance, zero for a user who never minted
     */
    public TokenAmount balance(InvocationContext ctx, String user) {
        return ctx.store().get(DataKey.balance(user), TokenAmount.class).orElse(TokenAmount.ZERO);
    }

    /**
     * Credit the starting balance on a user's first touch. Later calls return the
     * current balance and change nothing.
     */
    public TokenAmount mintInitial(InvocationContext ctx, String user) {
        DataKey key = DataKey.balance(user);
        Optional<TokenAmount> existing = ctx.store().get(key, TokenAmount.class);
        if (existing.isPresent()) {
            return existing.get();
        }

        ctx.store().put(key, initialMint);
        log.info("Minted initial balance for user {}: {}", user, initialMint);
        return initialMint;
    }

    public boolean hasSufficientBalance(InvocationContext ctx, String user, TokenAmount amount) {
        return balance(ctx, user).isGreaterThanOrEqualTo(amount);
    }

    public TokenAmount debit(InvocationContext ctx, String user, TokenAmount amount) {
        TokenAmount current = balance(ctx, user);
        if (current.isLessThan(amount)) {
            throw new SettlementException(SettlementError.INSUFFICIENT_BALANCE,
                    String.format("have %s, need %s", current, amount));
        }
        TokenAmount updated = current.subtract(amount);
        ctx.store().put(DataKey.balance(user), updated);
        return updated;
    }

    public TokenAmount credit(InvocationContext ctx, String user, TokenAmount amount) {
        TokenAmount updated = balance(ctx, user).add(amount);
        ctx.store().put(DataKey.balance(user), updated);
        return updated;
    }

    public TokenAmount getInitialMint() {
        return initialMint;
    }
}
