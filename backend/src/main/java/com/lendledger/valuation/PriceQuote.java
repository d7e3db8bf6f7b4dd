package com.lendledger.valuation;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Raw answer of a price feed. Lives only for the call that produced it.
 */
@Value
@Builder
public class PriceQuote {
    /** price of one whole asset unit, scaled by 10^decimals */
    BigInteger price;
    /** epoch seconds of the last feed update */
    long timestamp;
    int decimals;
    boolean sourceHealthy;
}
