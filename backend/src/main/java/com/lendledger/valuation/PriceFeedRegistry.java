package com.lendledger.valuation;

import com.lendledger.util.AddressUtil;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed asset -> feed lookup assembled once at startup.
 * An absent feed is a normal answer ("asset not supported"), not an error.
 */
public class PriceFeedRegistry {

    private final Map<String, PriceFeed> feeds = new LinkedHashMap<>();

    public PriceFeedRegistry register(String asset, PriceFeed feed) {
        feeds.put(AddressUtil.requireNonZero(asset, "asset"), feed);
        return this;
    }

    public Optional<PriceFeed> find(String asset) {
        if (AddressUtil.isZeroOrInvalid(asset)) return Optional.empty();
        return Optional.ofNullable(feeds.get(AddressUtil.normalize(asset)));
    }

    public Set<String> assets() {
        return Collections.unmodifiableSet(feeds.keySet());
    }
}
