package com.lendledger.risk;

import com.lendledger.math.FixedPointMath;

import java.math.BigInteger;

/**
 * Health factor in bps (10_000 = collateral equals debt). Pure functions over already valued inputs.
 */
public final class RiskEngine {
    private RiskEngine() {}

    /** Returned when there is no debt at all. */
    public static final BigInteger MAX_HEALTH_FACTOR = FixedPointMath.UINT256_MAX;

    public static BigInteger healthFactor(BigInteger totalCollateralValue, BigInteger totalDebtValue) {
        FixedPointMath.requireUint(totalCollateralValue, "totalCollateralValue");
        FixedPointMath.requireUint(totalDebtValue, "totalDebtValue");
        if (totalDebtValue.signum() == 0) return MAX_HEALTH_FACTOR;
        return FixedPointMath.mulDiv(totalCollateralValue, FixedPointMath.BPS, totalDebtValue);
    }

    public static boolean isUnderCollateralized(BigInteger totalCollateralValue, BigInteger totalDebtValue,
                                                long minHealthFactorBps) {
        return healthFactor(totalCollateralValue, totalDebtValue).compareTo(BigInteger.valueOf(minHealthFactorBps)) < 0;
    }
}
