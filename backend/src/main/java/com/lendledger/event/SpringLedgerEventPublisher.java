package com.lendledger.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/** Hands ledger events to Spring listeners. Listener failures are logged, never rethrown. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringLedgerEventPublisher implements LedgerEventPublisher {

    private final ApplicationEventPublisher delegate;

    @Override
    public void publish(LedgerEvent event) {
        try {
            delegate.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("[events] listener failed for {}: {}", event.getType(), e.toString());
        }
    }
}
