package com.lendledger.risk;

import com.lendledger.ledger.DebtValuation;
import com.lendledger.ledger.Ledger;
import com.lendledger.math.FixedPointMath;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.util.AddressUtil;
import com.lendledger.valuation.DegradationConfig;
import com.lendledger.valuation.ValuationResult;
import com.lendledger.valuation.ValuationService;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Values a user's whole portfolio and applies {@link RiskEngine}.
 * Degraded values are used as returned; an invalid collateral valuation counts as zero.
 */
@Slf4j
public class HealthFactorService {

    private final OperationBoundary boundary;
    private final Ledger ledger;
    private final ValuationService valuation;
    private final DegradationConfig collateralConfig;
    private final RiskThresholds thresholds;

    public HealthFactorService(OperationBoundary boundary, Ledger ledger, ValuationService valuation,
                               DegradationConfig collateralConfig, RiskThresholds thresholds) {
        this.boundary = boundary;
        this.ledger = ledger;
        this.valuation = valuation;
        this.collateralConfig = collateralConfig.validate();
        this.thresholds = thresholds;
    }

    /** Collateral and debt are read in one operation, so the report never mixes two states. */
    public HealthReport assess(String user) {
        String u = AddressUtil.requireNonZero(user, "user");
        return boundary.execute("assess", () -> assessInOperation(u));
    }

    private HealthReport assessInOperation(String u) {
        BigInteger collateralValue = BigInteger.ZERO;
        boolean degraded = false;
        for (String asset : ledger.getCollateralAssets(u)) {
            ValuationResult r = valuation.getValue(asset, ledger.getCollateral(u, asset), collateralConfig, "healthFactor");
            if (!r.isValid()) {
                log.warn("[risk] collateral of user={} asset={} counted as zero: {}", u, asset, r.getReason());
            }
            degraded |= r.isUsedFallback() || !r.isValid();
            collateralValue = FixedPointMath.add(collateralValue, r.isValid() ? r.getValue() : BigInteger.ZERO);
        }

        DebtValuation debt = ledger.refreshDebtValue(u);
        BigInteger hf = RiskEngine.healthFactor(collateralValue, debt.getValue());
        return HealthReport.builder()
                .user(u)
                .collateralValue(collateralValue)
                .debtValue(debt.getValue())
                .healthFactorBps(hf)
                .degraded(degraded || debt.isDegraded())
                .underCollateralized(RiskEngine.isUnderCollateralized(collateralValue, debt.getValue(), thresholds.getMinHealthFactorBps()))
                .borrowAllowed(hf.compareTo(BigInteger.valueOf(thresholds.getBorrowHealthFactorBps())) >= 0)
                .build();
    }

    public BigInteger healthFactor(String user) {
        return assess(user).getHealthFactorBps();
    }

    public RiskThresholds thresholds() {
        return thresholds;
    }
}
