package com.prediction.market.settlement_engine.security;

import java.util.Optional;

import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.store.DataKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Role checks for gated operations. The admin and oracle principals are written once by
 * {@link #initialize} and never change afterwards.
 *
 * Every gated operation calls one of the {@code require*} methods before anything else.
 */
@Slf4j
public class AccessController {

    public boolean isAuthorized(String requiredPrincipal, CallAuthorization caller) {
        return caller.isAuthorizedBy(requiredPrincipal);
    }

    public void initialize(InvocationContext ctx, String admin, String oracle) {
        if (ctx.store().has(DataKey.admin())) {
            throw new SettlementException(SettlementError.ALREADY_INITIALIZED);
        }
        if (isBlank(admin) || !isAuthorized(admin, ctx.caller())) {
            throw new SettlementException(SettlementError.UNAUTHORIZED_ADMIN, "initialize must be signed by the admin");
        }
        if (isBlank(oracle)) {
            throw new SettlementException(SettlementError.ORACLE_NOT_SET, "oracle principal is required");
        }

        ctx.store().put(DataKey.admin(), admin);
        ctx.store().put(DataKey.oracle(), oracle);
        log.info("Contract initialized: admin={}, oracle={}", admin, oracle);
    }

    public Optional<String> admin(InvocationContext ctx) {
        return ctx.store().get(DataKey.admin(), String.class);
    }

    public Optional<String> oracle(InvocationContext ctx) {
        return ctx.store().get(DataKey.oracle(), String.class);
    }

    public String requireAdmin(InvocationContext ctx) {
        String admin = admin(ctx).orElseThrow(() -> new SettlementException(SettlementError.ADMIN_NOT_SET));
        if (!isAuthorized(admin, ctx.caller())) {
            throw new SettlementException(SettlementError.UNAUTHORIZED_ADMIN);
        }
        return admin;
    }

    public String requireOracle(InvocationContext ctx) {
        String oracle = oracle(ctx).orElseThrow(() -> new SettlementException(SettlementError.ORACLE_NOT_SET));
        if (!isAuthorized(oracle, ctx.caller())) {
            throw new SettlementException(SettlementError.UNAUTHORIZED_ORACLE);
        }
        return oracle;
    }

    /**
     * A user may only act for themselves.
     */
    public void requireUser(InvocationContext ctx, String user) {
        if (isBlank(user) || !isAuthorized(user, ctx.caller())) {
            throw new SettlementException(SettlementError.UNAUTHORIZED_USER, "call not signed by " + user);
        }
    }

    private static boolean isBlank(String principal) {
        return principal == null || principal.isEmpty();
    }
}
