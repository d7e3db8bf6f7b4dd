package com.lendledger.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class HealthReport {
    String user;
    BigInteger collateralValue;
    BigInteger debtValue;
    BigInteger healthFactorBps;
    /** some valuation behind this report used a fallback or was rejected */
    boolean degraded;
    boolean underCollateralized;
    /** health factor at or above the borrow / withdraw gate */
    boolean borrowAllowed;
}
