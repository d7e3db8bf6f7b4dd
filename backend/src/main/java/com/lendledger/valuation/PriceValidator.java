package com.lendledger.valuation;

import com.lendledger.math.FixedPointMath;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Plausibility checks on a raw quote. Every check answers with the failure detail, or empty
 * when the quote passes.
 */
public final class PriceValidator {
    private PriceValidator() {}

    public static final int MIN_DECIMALS = 6;
    public static final int MAX_DECIMALS = 18;

    public static Optional<String> checkDecimals(int decimals) {
        if (decimals < MIN_DECIMALS) return Optional.of("Decimals too low (minimum: " + MIN_DECIMALS + ")");
        if (decimals > MAX_DECIMALS) return Optional.of("Decimals too high (maximum: " + MAX_DECIMALS + ")");
        return Optional.empty();
    }

    /** Conditions that make the quote unusable, treated like a failed call. */
    public static Optional<String> checkUsable(PriceQuote q, long nowEpochSeconds, ValidationConfig cfg) {
        if (q.getPrice() == null || q.getPrice().signum() <= 0) {
            return Optional.of("Invalid price: " + q.getPrice());
        }
        if (!q.isSourceHealthy()) {
            return Optional.of("Price source reported unhealthy");
        }
        if (q.getTimestamp() > 0 && nowEpochSeconds - q.getTimestamp() > cfg.getMaxPriceAgeSeconds()) {
            return Optional.of("Price is stale");
        }
        return Optional.empty();
    }

    /**
     * Absolute ceiling and the band around the reference price.
     * @param reference last-known-good price of the asset, when there is one
     */
    public static Optional<String> checkReasonable(PriceQuote q,
                                                   Optional<LastKnownPriceCache.CachedPrice> reference,
                                                   ValidationConfig cfg) {
        BigInteger normalized = normalize(q.getPrice(), q.getDecimals());
        // compared before any checked arithmetic: a price above the ceiling may not fit a uint256 at 18 decimals
        if (normalized.compareTo(cfg.getMaxReasonablePrice()) > 0) {
            return Optional.of("price " + normalized + " above ceiling " + cfg.getMaxReasonablePrice());
        }
        if (reference.isEmpty()) return Optional.empty();

        BigInteger ref = reference.get().normalized();
        BigInteger low = FixedPointMath.bps(ref, cfg.getMinMultiplierBps());
        BigInteger high = FixedPointMath.bps(ref, cfg.getMaxMultiplierBps());
        if (normalized.compareTo(low) < 0 || normalized.compareTo(high) > 0) {
            return Optional.of("price " + normalized + " outside [" + low + ", " + high + "] of reference " + ref);
        }
        return Optional.empty();
    }

    /**
     * Rescales a price with {@code decimals} to 18 decimals. Unbounded: the result is only compared,
     * never stored, and a quote that passed the ceiling always fits a uint256.
     */
    static BigInteger normalize(BigInteger price, int decimals) {
        if (decimals >= 18) return price.divide(FixedPointMath.pow10(decimals - 18));
        return price.multiply(FixedPointMath.pow10(18 - decimals));
    }
}
