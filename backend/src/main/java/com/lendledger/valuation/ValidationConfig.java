package com.lendledger.valuation;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Price plausibility bounds. Prices are compared after normalisation to 18 decimals.
 */
@Value
@Builder
public class ValidationConfig {
    /** lowest accepted price relative to the reference price, in bps (5000 = 50%) */
    @Builder.Default
    long minMultiplierBps = 5_000;
    /** highest accepted price relative to the reference price, in bps (15000 = 150%) */
    @Builder.Default
    long maxMultiplierBps = 15_000;
    /** absolute ceiling for a normalised (18 decimals) price */
    @Builder.Default
    BigInteger maxReasonablePrice = BigInteger.TEN.pow(30);
    /** quotes older than this are treated as a failed call */
    @Builder.Default
    long maxPriceAgeSeconds = 3_600;

    public static ValidationConfig defaults() {
        return ValidationConfig.builder().build();
    }
}
