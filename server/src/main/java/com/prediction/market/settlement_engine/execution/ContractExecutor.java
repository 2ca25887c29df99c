package com.prediction.market.settlement_engine.execution;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.events.SettlementEventSink;
import com.prediction.market.settlement_engine.ledger.LedgerClock;
import com.prediction.market.settlement_engine.ledger.LedgerInfo;
import com.prediction.market.settlement_engine.security.CallAuthorization;
import com.prediction.market.settlement_engine.store.StagedStateStore;
import com.prediction.market.settlement_engine.store.StateStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs engine operations one at a time, each as an all-or-nothing unit.
 *
 * Every invocation gets a fresh {@link StagedStateStore} over the backing store and a
 * ledger snapshot. On success the staged writes are committed and queued events are
 * published; on any exception both are dropped and the exception reaches the caller.
 */
@Slf4j
public class ContractExecutor implements AutoCloseable {

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "contract-executor");
        thread.setDaemon(true);
        return thread;
    });

    private final StateStore stateStore;
    private final LedgerClock ledgerClock;
    private final SettlementEventSink eventSink;

    public ContractExecutor(StateStore stateStore, LedgerClock ledgerClock, SettlementEventSink eventSink) {
        this.stateStore = stateStore;
        this.ledgerClock = ledgerClock;
        this.eventSink = eventSink;
    }

    /**
     * Execute {@code operation} on the executor thread and wait for its result.
     *
     * @param caller principals that authorized this call
     * @param operation the engine call
     * @return whatever the operation returned
     * @throws SettlementException when the operation rejects the call
     */
    public <T> T invoke(CallAuthorization caller, Function<InvocationContext, T> operation) {
        Future<T> future = executor.submit(() -> execute(caller, operation));
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for invocation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Invocation failed", cause);
        }
    }

    /**
     * Read-only call without any caller authorization.
     */
    public <T> T query(Function<InvocationContext, T> operation) {
        return invoke(CallAuthorization.none(), operation);
    }

    private <T> T execute(CallAuthorization caller, Function<InvocationContext, T> operation) {
        LedgerInfo ledger = ledgerClock.current();
        StagedStateStore staged = new StagedStateStore(stateStore);
        InvocationContext context = new InvocationContext(staged, ledger, caller);

        T result;
        try {
            result = operation.apply(context);
        } catch (SettlementException e) {
            log.warn("Invocation rejected: {} (caller={}, ledger={})", e.getError(), caller.getPrincipals(), ledger.sequence());
            throw e;
        } catch (RuntimeException e) {
            log.error("Invocation failed unexpectedly (caller={}, ledger={})", caller.getPrincipals(), ledger.sequence(), e);
            throw e;
        }

        staged.commit();
        for (Object event : context.events()) {
            eventSink.publish(event);
        }
        return result;
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
