package com.lendledger.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Valuation did not come cleanly from the price feed. Operators reconcile fallback usage
 * from these records after the fact.
 */
@Value
@Builder
public class DegradationTriggeredEvent implements LedgerEvent {
    String asset;
    String operation;
    String reason;
    BigInteger fallbackValue;
    boolean usedFallback;
    boolean valid;
    Instant occurredAt;

    @Override
    public String getType() {
        return "DEGRADATION_TRIGGERED";
    }
}
