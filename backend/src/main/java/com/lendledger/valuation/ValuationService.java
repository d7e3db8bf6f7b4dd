package com.lendledger.valuation;

import java.math.BigInteger;
import java.util.List;

/**
 * Values asset amounts through the external price feed with graceful degradation.
 */
public interface ValuationService {

    ValuationResult getValue(String asset, BigInteger amount, DegradationConfig config);

    /**
     * @param operation name of the calling operation, carried by degradation signals
     */
    ValuationResult getValue(String asset, BigInteger amount, DegradationConfig config, String operation);

    /** Read-only probe; never throws and never mutates state. */
    OracleHealth checkPriceOracleHealth(String asset);

    List<OracleHealth> checkPriceOracleHealthBatch(List<String> assets);
}
