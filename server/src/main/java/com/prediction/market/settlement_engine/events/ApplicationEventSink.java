package com.prediction.market.settlement_engine.events;

import org.springframework.context.ApplicationEventPublisher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards engine events to Spring listeners. Events arrive after their invocation has
 * committed, so a failing listener is logged and never reported to the caller.
 */
@Slf4j
@RequiredArgsConstructor
public class ApplicationEventSink implements SettlementEventSink {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(Object event) {
        log.info("Event: {}", event);
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed for event {}", event, e);
        }
    }
}
