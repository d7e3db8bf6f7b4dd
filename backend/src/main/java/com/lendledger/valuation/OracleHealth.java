package com.lendledger.valuation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Result of a read-only oracle probe. */
@Value
@Builder
public class OracleHealth {
    public static final String HEALTHY = "Healthy";

    String asset;
    boolean healthy;
    String details;
    Instant checkedAt;

    static OracleHealth unhealthy(String asset, String details, Instant at) {
        return OracleHealth.builder().asset(asset).healthy(false).details(details).checkedAt(at).build();
    }

    static OracleHealth ok(String asset, Instant at) {
        return OracleHealth.builder().asset(asset).healthy(true).details(HEALTHY).checkedAt(at).build();
    }
}
