package com.lendledger.valuation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PriceValidator")
class PriceValidatorTest {

    private final ValidationConfig cfg = ValidationConfig.defaults();

    private static PriceQuote quote(long whole, int decimals) {
        return PriceQuote.builder()
                .price(BigInteger.valueOf(whole).multiply(BigInteger.TEN.pow(decimals)))
                .decimals(decimals)
                .timestamp(1_000)
                .sourceHealthy(true)
                .build();
    }

    @Test
    @DisplayName("decimals bounds are inclusive")
    void decimalsBounds() {
        assertThat(PriceValidator.checkDecimals(6)).isEmpty();
        assertThat(PriceValidator.checkDecimals(18)).isEmpty();
        assertThat(PriceValidator.checkDecimals(5)).contains("Decimals too low (minimum: 6)");
        assertThat(PriceValidator.checkDecimals(19)).contains("Decimals too high (maximum: 18)");
    }

    @Test
    @DisplayName("reference band compares prices with different decimals")
    void bandAcrossDecimals() {
        LastKnownPriceCache.CachedPrice ref = new LastKnownPriceCache.CachedPrice(
                BigInteger.valueOf(2_000).multiply(BigInteger.TEN.pow(8)), 8, 0);

        assertThat(PriceValidator.checkReasonable(quote(2_900, 18), Optional.of(ref), cfg)).isEmpty();
        assertThat(PriceValidator.checkReasonable(quote(1_000, 6), Optional.of(ref), cfg)).isEmpty();
        assertThat(PriceValidator.checkReasonable(quote(999, 6), Optional.of(ref), cfg)).isPresent();
        assertThat(PriceValidator.checkReasonable(quote(3_001, 18), Optional.of(ref), cfg)).isPresent();
    }

    @Test
    @DisplayName("usable means positive, healthy and fresh")
    void usable() {
        PriceQuote q = quote(1, 8);
        assertThat(PriceValidator.checkUsable(q, 1_000 + 3_600, cfg)).isEmpty();
        assertThat(PriceValidator.checkUsable(q, 1_000 + 3_601, cfg)).contains("Price is stale");
        PriceQuote unhealthy = PriceQuote.builder().price(q.getPrice()).decimals(8).timestamp(1_000).sourceHealthy(false).build();
        assertThat(PriceValidator.checkUsable(unhealthy, 1_000, cfg)).contains("Price source reported unhealthy");
        PriceQuote negative = PriceQuote.builder().price(BigInteger.valueOf(-1)).decimals(8).timestamp(1_000).sourceHealthy(true).build();
        assertThat(PriceValidator.checkUsable(negative, 1_000, cfg)).isPresent();
    }
}
