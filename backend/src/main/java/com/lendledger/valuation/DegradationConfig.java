package com.lendledger.valuation;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.util.AddressUtil;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Fallback policy of a valuation. Collateral and debt use different instances: a degraded
 * collateral value is scaled down, a degraded debt value is scaled up.
 */
@Value
@Builder
public class DegradationConfig {
    /** ratio applied to the last-known-good value, in bps */
    @Builder.Default
    int conservativeRatioBps = 5_000;
    @Builder.Default
    boolean useStablecoinFaceValue = true;
    @Builder.Default
    boolean enablePriceCache = true;
    /** settlement asset, valued at face when its feed is down */
    String settlementAsset;
    /** further assets accepted at face value */
    @Singular
    Set<String> stablecoins;

    public boolean isStablecoin(String asset) {
        if (asset == null) return false;
        if (settlementAsset != null && settlementAsset.equalsIgnoreCase(asset)) return true;
        return stablecoins.stream().anyMatch(s -> s.equalsIgnoreCase(asset));
    }

    /** Checks the ratio bounds and address fields; returns this for chaining. */
    public DegradationConfig validate() {
        if (conservativeRatioBps <= 0 || conservativeRatioBps > 20_000) {
            throw LedgerException.of(ErrorCode.INVALID_CONFIG,
                    "conservativeRatioBps must be in (0, 20000]: " + conservativeRatioBps);
        }
        if (settlementAsset != null) AddressUtil.normalize(settlementAsset);
        stablecoins.forEach(AddressUtil::normalize);
        return this;
    }
}
