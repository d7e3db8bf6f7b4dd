package com.lendledger.valuation;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last validated price per asset. Serves both as the reference price for plausibility checks
 * and as the source of the conservative fallback.
 */
public class LastKnownPriceCache {

    @Value
    public static class CachedPrice {
        BigInteger price;
        int decimals;
        long timestamp;

        /** Price rescaled to 18 decimals so quotes with different decimals compare. */
        public BigInteger normalized() {
            return PriceValidator.normalize(price, decimals);
        }
    }

    private final Map<String, CachedPrice> prices = new ConcurrentHashMap<>();

    public Optional<CachedPrice> get(String asset) {
        return Optional.ofNullable(prices.get(asset));
    }

    public void put(String asset, PriceQuote quote) {
        prices.put(asset, new CachedPrice(quote.getPrice(), quote.getDecimals(), quote.getTimestamp()));
    }

    public void evict(String asset) {
        prices.remove(asset);
    }
}
