package com.lendledger.valuation;

/**
 * External price source for one or more assets.
 * Implementations throw any RuntimeException on failure; the valuation layer turns that into a fallback.
 */
public interface PriceFeed {

    PriceQuote latestQuote(String asset);

    /** Short label used in logs and health details, e.g. "chainlink:base". */
    String name();
}
