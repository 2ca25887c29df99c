package com.prediction.market.settlement_engine.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.prediction.market.settlement_engine.ledger.LedgerInfo;
import com.prediction.market.settlement_engine.security.CallAuthorization;
import com.prediction.market.settlement_engine.store.StateStore;

/**
 * Everything one operation may touch: the state, the ledger position, the caller's proof
 * of authorization and the events it raises. Owned by the host and passed to every
 * engine call; engine components keep no state of their own.
 */
public class InvocationContext {

    private final StateStore store;
    private final LedgerInfo ledger;
    private final CallAuthorization caller;
    private final List<Object> events = new ArrayList<>();

    public InvocationContext(StateStore store, LedgerInfo ledger, CallAuthorization caller) {
        this.store = store;
        this.ledger = ledger;
        this.caller = caller;
    }

    public StateStore store() {
        return store;
    }

    public LedgerInfo ledger() {
        return ledger;
    }

    public long sequence() {
        return ledger.sequence();
    }

    public long timestamp() {
        return ledger.timestamp();
    }

    public CallAuthorization caller() {
        return caller;
    }

    /**
     * Queue an event; it is published only if the invocation commits.
     */
    public void emit(Object event) {
        events.add(event);
    }

    public List<Object> events() {
        return Collections.unmodifiableList(events);
    }
}
