package com.lendledger.event;

import java.time.Instant;

/** Domain signal emitted by the core after a state change or a degraded valuation. */
public interface LedgerEvent {

    /** Stable upper-case event name, e.g. GUARANTEE_LOCKED. */
    String getType();

    Instant getOccurredAt();
}
