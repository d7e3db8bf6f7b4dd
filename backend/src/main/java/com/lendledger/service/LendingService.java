package com.lendledger.service;

import com.lendledger.access.AuthorizationCheck;
import com.lendledger.access.LedgerActions;
import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.guarantee.GuaranteeRecord;
import com.lendledger.guarantee.GuaranteeStore;
import com.lendledger.ledger.Ledger;
import com.lendledger.ledger.Position;
import com.lendledger.risk.HealthFactorService;
import com.lendledger.risk.HealthReport;
import com.lendledger.settlement.EarlyRepaymentBreakdown;
import com.lendledger.settlement.LiquidationResult;
import com.lendledger.settlement.SettlementEngine;
import com.lendledger.settlement.SettlementResult;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.valuation.OracleHealth;
import com.lendledger.valuation.ValuationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Front door of the ledger. Checks the caller's claim and runs each use case as one
 * all-or-nothing operation; borrow and withdraw are gated on the resulting health factor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LendingService {

    private final OperationBoundary boundary;
    private final AuthorizationCheck auth;
    private final Ledger ledger;
    private final HealthFactorService health;
    private final GuaranteeStore guarantees;
    private final SettlementEngine settlement;
    private final ValuationService valuation;

    // ----- positions -----

    public Position deposit(String caller, String user, String asset, BigInteger amount) {
        auth.requireClaim(LedgerActions.DEPOSIT, caller);
        return boundary.execute("deposit", () -> {
            ledger.recordDeposit(user, asset, amount);
            return ledger.getPosition(user, asset);
        });
    }

    public Position withdraw(String caller, String user, String asset, BigInteger amount) {
        auth.requireClaim(LedgerActions.WITHDRAW, caller);
        return boundary.execute("withdraw", () -> {
            ledger.recordWithdraw(user, asset, amount);
            requireBorrowHealth(user, "withdraw");
            return ledger.getPosition(user, asset);
        });
    }

    public Position borrow(String caller, String user, String asset, BigInteger amount) {
        auth.requireClaim(LedgerActions.BORROW, caller);
        return boundary.execute("borrow", () -> {
            ledger.recordBorrow(user, asset, amount);
            requireBorrowHealth(user, "borrow");
            return ledger.getPosition(user, asset);
        });
    }

    public Position repay(String caller, String user, String asset, BigInteger amount) {
        auth.requireClaim(LedgerActions.REPAY, caller);
        return boundary.execute("repay", () -> {
            ledger.recordRepay(user, asset, amount);
            return ledger.getPosition(user, asset);
        });
    }

    public LiquidationResult liquidate(String caller, String user, String debtAsset, BigInteger debtAmount,
                                       String collateralAsset, BigInteger seizeAmount) {
        auth.requireClaim(LedgerActions.LIQUIDATE, caller);
        return settlement.processLiquidation(caller, user, debtAsset, debtAmount, collateralAsset, seizeAmount);
    }

    // ----- guarantees -----

    public GuaranteeRecord lockGuarantee(String caller, String borrower, String lender, String asset,
                                         BigInteger principal, BigInteger promisedInterest, int termDays) {
        auth.requireClaim(LedgerActions.LOCK_GUARANTEE, caller);
        long id = settlement.lockGuarantee(borrower, lender, asset, principal, promisedInterest, termDays);
        return guarantees.get(id);
    }

    public EarlyRepaymentBreakdown previewEarlyRepayment(long guaranteeId, BigInteger actualRepayAmount) {
        return settlement.previewEarlyRepayment(guaranteeId, actualRepayAmount);
    }

    public SettlementResult earlyRepay(String caller, String borrower, String asset, BigInteger actualRepayAmount) {
        auth.requireClaim(LedgerActions.SETTLE, caller);
        return settlement.processEarlyRepayment(borrower, asset, actualRepayAmount);
    }

    public SettlementResult maturedRepay(String caller, String borrower, String asset, BigInteger actualRepayAmount) {
        auth.requireClaim(LedgerActions.SETTLE, caller);
        return settlement.processMaturedRepayment(borrower, asset, actualRepayAmount);
    }

    public SettlementResult declareDefault(String caller, String borrower, String asset) {
        auth.requireClaim(LedgerActions.SETTLE, caller);
        return settlement.processDefault(borrower, asset);
    }

    public GuaranteeRecord getGuarantee(long id) {
        return guarantees.get(id);
    }

    public List<Long> getActiveGuaranteeIds(String borrower) {
        return guarantees.getActiveGuaranteeIds(borrower);
    }

    // ----- governance -----

    public void setPlatformFeeRate(String caller, int bps) {
        auth.requireClaim(LedgerActions.GOVERN, caller);
        settlement.setPlatformFeeRate(bps);
    }

    public void setPlatformFeeReceiver(String caller, String receiver) {
        auth.requireClaim(LedgerActions.GOVERN, caller);
        settlement.setPlatformFeeReceiver(receiver);
    }

    // ----- reads -----

    public Position getPosition(String user, String asset) {
        return ledger.getPosition(user, asset);
    }

    public HealthReport healthFactor(String user) {
        return health.assess(user);
    }

    public OracleHealth checkPriceOracleHealth(String asset) {
        return valuation.checkPriceOracleHealth(asset);
    }

    public List<OracleHealth> checkPriceOracleHealthBatch(List<String> assets) {
        return valuation.checkPriceOracleHealthBatch(assets);
    }

    private void requireBorrowHealth(String user, String operation) {
        HealthReport report = health.assess(user);
        if (!report.isBorrowAllowed()) {
            throw LedgerException.of(ErrorCode.HEALTH_FACTOR_TOO_LOW,
                    operation + " would leave health factor at " + report.getHealthFactorBps()
                            + " bps, below " + health.thresholds().getBorrowHealthFactorBps());
        }
        if (report.isDegraded()) {
            log.warn("[lending] {} for {} approved on degraded valuation, hf={}", operation, user, report.getHealthFactorBps());
        }
    }
}
