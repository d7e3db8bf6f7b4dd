package com.lendledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
@Builder
public class LiquidationResult {
    String user;
    String debtAsset;
    String collateralAsset;
    BigInteger debtReduced;
    BigInteger collateralSeized;
    BigInteger healthFactorBefore;
    List<PlannedTransfer> transfers;
}
