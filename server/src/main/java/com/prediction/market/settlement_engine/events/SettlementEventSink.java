package com.prediction.market.settlement_engine.events;

/**
 * Receives engine events after the invocation that raised them has committed.
 */
public interface SettlementEventSink {

    void publish(Object event);
}
