package com.lendledger.valuation;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.event.DegradationTriggeredEvent;
import com.lendledger.event.LedgerEventPublisher;
import com.lendledger.math.FixedPointMath;
import com.lendledger.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Valuation with graceful degradation.
 *
 * Order of checks for a non-zero amount:
 *  1) fetch the quote (missing feed, exception, non-positive, unhealthy or stale -> fallback);
 *  2) decimals outside [6, 18] -> REJECTED, no fallback;
 *  3) ceiling / reference band -> fallback with "price implausible";
 *  4) value = amount * price / 10^decimals and refresh the last-known-good cache.
 *
 * Fallback chain: stablecoin face value, then last-known-good price scaled by the conservative
 * ratio, then fail closed. Degradation signals go straight to the publisher so they survive a
 * rollback of the calling operation.
 */
@Slf4j
@RequiredArgsConstructor
public class GracefulValuationService implements ValuationService {

    private final PriceFeedRegistry feeds;
    private final LastKnownPriceCache cache;
    private final ValidationConfig validation;
    private final LedgerEventPublisher events;
    private final Clock clock;

    @Override
    public ValuationResult getValue(String asset, BigInteger amount, DegradationConfig config) {
        return getValue(asset, amount, config, "getValue");
    }

    @Override
    public ValuationResult getValue(String asset, BigInteger amount, DegradationConfig config, String operation) {
        final String a = AddressUtil.requireNonZero(asset, "asset");
        FixedPointMath.requireUint(amount, "amount");
        if (config == null) throw LedgerException.of(ErrorCode.INVALID_CONFIG, "degradation config is null");

        if (amount.signum() == 0) return ValuationResult.zero();

        final PriceQuote quote;
        try {
            quote = fetch(a);
        } catch (RuntimeException e) {
            log.warn("[valuation] feed call failed asset={} op={}: {}", a, operation, e.toString());
            return fallback(a, amount, config, operation, ValuationResult.REASON_CALL_FAILED, describe(e));
        }

        Optional<String> badDecimals = PriceValidator.checkDecimals(quote.getDecimals());
        if (badDecimals.isPresent()) {
            log.warn("[valuation] rejected asset={} op={}: {}", a, operation, badDecimals.get());
            return signal(a, operation, ValuationResult.rejected(badDecimals.get(), quote.getDecimals()));
        }

        Optional<String> unusable = PriceValidator.checkUsable(quote, clock.instant().getEpochSecond(), validation);
        if (unusable.isPresent()) {
            log.warn("[valuation] unusable quote asset={} op={}: {}", a, operation, unusable.get());
            return fallback(a, amount, config, operation, ValuationResult.REASON_CALL_FAILED, unusable.get());
        }

        Optional<String> implausible = PriceValidator.checkReasonable(quote, cache.get(a), validation);
        if (implausible.isPresent()) {
            log.warn("[valuation] implausible quote asset={} op={}: {}", a, operation, implausible.get());
            return fallback(a, amount, config, operation, ValuationResult.REASON_IMPLAUSIBLE, implausible.get());
        }

        BigInteger value = FixedPointMath.mulDiv(amount, quote.getPrice(), FixedPointMath.pow10(quote.getDecimals()));
        cache.put(a, quote);
        return ValuationResult.priced(value, quote.getDecimals());
    }

    @Override
    public OracleHealth checkPriceOracleHealth(String asset) {
        Instant now = clock.instant();
        if (AddressUtil.isZeroOrInvalid(asset)) return OracleHealth.unhealthy(asset, "Zero address", now);

        String a = AddressUtil.normalize(asset);
        Optional<PriceFeed> feed = feeds.find(a);
        if (feed.isEmpty()) return OracleHealth.unhealthy(a, "Asset not supported", now);

        final PriceQuote quote;
        try {
            quote = feed.get().latestQuote(a);
        } catch (RuntimeException e) {
            log.debug("[valuation] health probe failed asset={} feed={}: {}", a, feed.get().name(), e.toString());
            return OracleHealth.unhealthy(a, "Price oracle call failed: " + describe(e), now);
        }
        if (quote == null) return OracleHealth.unhealthy(a, "Price oracle call failed: empty answer", now);

        Optional<String> problem = PriceValidator.checkDecimals(quote.getDecimals())
                .or(() -> PriceValidator.checkUsable(quote, now.getEpochSecond(), validation));
        return problem.map(p -> OracleHealth.unhealthy(a, p, now)).orElseGet(() -> OracleHealth.ok(a, now));
    }

    @Override
    public List<OracleHealth> checkPriceOracleHealthBatch(List<String> assets) {
        List<OracleHealth> out = new ArrayList<>(assets.size());
        for (String asset : assets) out.add(checkPriceOracleHealth(asset));
        return out;
    }

    // ----- internals -----

    private PriceQuote fetch(String asset) {
        PriceFeed feed = feeds.find(asset)
                .orElseThrow(() -> new IllegalStateException("asset not supported"));
        PriceQuote q = feed.latestQuote(asset);
        if (q == null) throw new IllegalStateException("empty answer from " + feed.name());
        return q;
    }

    private ValuationResult fallback(String asset, BigInteger amount, DegradationConfig config,
                                     String operation, String reason, String detail) {
        final String fullReason = reason + ": " + detail;
        ValuationResult r;
        if (config.isUseStablecoinFaceValue() && config.isStablecoin(asset)) {
            r = ValuationResult.degraded(amount, fullReason, 0);
        } else if (config.isEnablePriceCache() && cache.get(asset).isPresent()) {
            LastKnownPriceCache.CachedPrice cached = cache.get(asset).get();
            BigInteger raw = FixedPointMath.mulDiv(amount, cached.getPrice(), FixedPointMath.pow10(cached.getDecimals()));
            r = ValuationResult.degraded(FixedPointMath.bps(raw, config.getConservativeRatioBps()),
                    fullReason, cached.getDecimals());
        } else {
            r = ValuationResult.failedClosed(fullReason);
        }
        log.warn("[valuation] fallback asset={} op={} status={} value={}", asset, operation, r.getStatus(), r.getValue());
        return signal(asset, operation, r);
    }

    private ValuationResult signal(String asset, String operation, ValuationResult r) {
        events.publish(DegradationTriggeredEvent.builder()
                .asset(asset)
                .operation(operation)
                .reason(r.getReason())
                .fallbackValue(r.getValue())
                .usedFallback(r.isUsedFallback())
                .valid(r.isValid())
                .occurredAt(clock.instant())
                .build());
        return r;
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
