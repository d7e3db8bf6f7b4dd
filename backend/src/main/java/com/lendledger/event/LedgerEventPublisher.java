package com.lendledger.event;

/** Outbound port for ledger events. Implementations must not throw back into the core. */
public interface LedgerEventPublisher {

    void publish(LedgerEvent event);
}
