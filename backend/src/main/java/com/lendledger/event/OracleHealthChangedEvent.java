package com.lendledger.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class OracleHealthChangedEvent implements LedgerEvent {
    String asset;
    boolean healthy;
    String details;
    Instant occurredAt;

    @Override
    public String getType() {
        return "ORACLE_HEALTH_CHANGED";
    }
}
