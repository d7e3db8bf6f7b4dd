package com.lendledger.settlement;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.event.GuaranteeLockedEvent;
import com.lendledger.event.GuaranteeTerminatedEvent;
import com.lendledger.guarantee.GuaranteeFund;
import com.lendledger.guarantee.GuaranteeRecord;
import com.lendledger.guarantee.GuaranteeStatus;
import com.lendledger.guarantee.GuaranteeStore;
import com.lendledger.ledger.Ledger;
import com.lendledger.math.FixedPointMath;
import com.lendledger.risk.HealthFactorService;
import com.lendledger.risk.HealthReport;
import com.lendledger.transfer.FundTransfer;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Guarantee settlement: early repayment, repayment at maturity, default, and liquidation.
 *
 * Every operation runs as one {@link OperationBoundary} call in three phases:
 *  1) checks (including any valuation), no state touched;
 *  2) effects: guarantee closed, escrow released or forfeited, debt reduced, transfers queued;
 *  3) interactions: the closed {@link SettlementPlan} is issued.
 * A re-entrant call from a transfer therefore sees the guarantee already terminated. A failed
 * transfer aborts the call and the boundary rolls back phase 2.
 */
@Slf4j
public class SettlementEngine {

    private final OperationBoundary boundary;
    private final GuaranteeStore store;
    private final GuaranteeFund fund;
    private final Ledger ledger;
    private final HealthFactorService health;
    private final FundTransfer transfer;
    private final SettlementSettings settings;
    private final Clock clock;

    public SettlementEngine(OperationBoundary boundary, GuaranteeStore store, GuaranteeFund fund, Ledger ledger,
                            HealthFactorService health, FundTransfer transfer, SettlementSettings settings,
                            Clock clock) {
        this.boundary = boundary;
        this.store = store;
        this.fund = fund;
        this.ledger = ledger;
        this.health = health;
        this.transfer = transfer;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Stores a new guarantee and escrows its promised interest.
     * @return the guarantee id
     */
    public long lockGuarantee(String borrower, String lender, String asset,
                              BigInteger principal, BigInteger promisedInterest, int termDays) {
        return boundary.execute("lockGuarantee", () -> {
            long id = store.lock(borrower, lender, asset, principal, promisedInterest, termDays,
                    settings.getEarlyRepayPenaltyDays());
            GuaranteeRecord rec = store.get(id);
            fund.lock(rec.getBorrower(), rec.getAsset(), rec.getPromisedInterest());
            boundary.journal().publish(GuaranteeLockedEvent.builder()
                    .guaranteeId(id)
                    .borrower(rec.getBorrower())
                    .lender(rec.getLender())
                    .asset(rec.getAsset())
                    .principal(rec.getPrincipal())
                    .promisedInterest(rec.getPromisedInterest())
                    .startTime(rec.getStartTime())
                    .maturityTime(rec.getMaturityTime())
                    .earlyRepayPenaltyDays(rec.getEarlyRepayPenaltyDays())
                    .occurredAt(clock.instant())
                    .build());
            return id;
        });
    }

    /** Read-only: what {@link #processEarlyRepayment} would pay out right now. */
    public EarlyRepaymentBreakdown previewEarlyRepayment(long guaranteeId, BigInteger actualRepayAmount) {
        return boundary.read(() -> {
            GuaranteeRecord rec = store.get(guaranteeId);
            if (!rec.isActive()) {
                throw LedgerException.of(ErrorCode.GUARANTEE_NOT_ACTIVE, "guarantee " + guaranteeId + " is " + rec.getStatus());
            }
            long now = nowAfterStart(rec);
            requireCovers(rec, actualRepayAmount);
            return breakdown(rec, actualRepayAmount, now);
        });
    }

    public SettlementResult processEarlyRepayment(String borrower, String asset, BigInteger actualRepayAmount) {
        return boundary.execute("processEarlyRepayment", () -> {
            // checks
            GuaranteeRecord rec = requireActive(borrower, asset);
            long now = nowAfterStart(rec);
            if (now >= rec.getMaturityTime()) {
                throw LedgerException.of(ErrorCode.GUARANTEE_MATURED,
                        "guarantee " + rec.getId() + " matured at " + rec.getMaturityTime() + ", use matured repayment");
            }
            requireCovers(rec, actualRepayAmount);
            EarlyRepaymentBreakdown b = breakdown(rec, actualRepayAmount, now);

            // effects
            store.markTerminal(rec.getId(), GuaranteeStatus.EARLY_REPAID);
            fund.release(rec.getBorrower(), rec.getAsset(), rec.getPromisedInterest());
            BigInteger debtReduced = ledger.recordForceReduceDebt(rec.getBorrower(), rec.getAsset(), rec.getPrincipal());

            SettlementPlan plan = new SettlementPlan("processEarlyRepayment#" + rec.getId())
                    .pay(rec.getAsset(), rec.getLender(), b.getLenderCompensation(), "lender")
                    .pay(rec.getAsset(), settings.getPlatformFeeReceiver(), b.getPlatformFee(), "platform-fee")
                    .pay(rec.getAsset(), rec.getBorrower(), b.getRefundToBorrower(), "borrower-refund");

            SettlementResult.SettlementResultBuilder result = SettlementResult.builder()
                    .guaranteeId(rec.getId())
                    .outcome(GuaranteeStatus.EARLY_REPAID)
                    .principal(rec.getPrincipal())
                    .actualInterestPaid(b.getActualInterestPaid())
                    .penaltyToLender(b.getPenaltyToLender())
                    .platformFee(b.getPlatformFee())
                    .refundToBorrower(b.getRefundToBorrower())
                    .lenderCompensation(b.getLenderCompensation())
                    .uncoveredPrincipal(BigInteger.ZERO)
                    .debtReduced(debtReduced);
            return finish(rec, plan, result);
        });
    }

    /** On-time outcome: the lender gets principal plus the full promised interest. */
    public SettlementResult processMaturedRepayment(String borrower, String asset, BigInteger actualRepayAmount) {
        return boundary.execute("processMaturedRepayment", () -> {
            GuaranteeRecord rec = requireActive(borrower, asset);
            long now = nowAfterStart(rec);
            if (now < rec.getMaturityTime()) {
                throw LedgerException.of(ErrorCode.GUARANTEE_NOT_MATURED,
                        "guarantee " + rec.getId() + " matures at " + rec.getMaturityTime() + ", now " + now);
            }
            requireCovers(rec, actualRepayAmount);
            BigInteger refund = FixedPointMath.sub(actualRepayAmount, rec.getPrincipal());
            BigInteger toLender = FixedPointMath.add(rec.getPrincipal(), rec.getPromisedInterest());

            store.markTerminal(rec.getId(), GuaranteeStatus.MATURED_REPAID);
            fund.release(rec.getBorrower(), rec.getAsset(), rec.getPromisedInterest());
            BigInteger debtReduced = ledger.recordForceReduceDebt(rec.getBorrower(), rec.getAsset(), rec.getPrincipal());

            SettlementPlan plan = new SettlementPlan("processMaturedRepayment#" + rec.getId())
                    .pay(rec.getAsset(), rec.getLender(), toLender, "lender")
                    .pay(rec.getAsset(), rec.getBorrower(), refund, "borrower-refund");

            SettlementResult.SettlementResultBuilder result = SettlementResult.builder()
                    .guaranteeId(rec.getId())
                    .outcome(GuaranteeStatus.MATURED_REPAID)
                    .principal(rec.getPrincipal())
                    .actualInterestPaid(rec.getPromisedInterest())
                    .penaltyToLender(BigInteger.ZERO)
                    .platformFee(BigInteger.ZERO)
                    .refundToBorrower(refund)
                    .lenderCompensation(toLender)
                    .uncoveredPrincipal(BigInteger.ZERO)
                    .debtReduced(debtReduced);
            return finish(rec, plan, result);
        });
    }

    /**
     * Defaults an overdue guarantee, or one whose borrower is under-collateralized.
     * The escrowed interest goes to the lender; the principal stays as debt for liquidation.
     */
    public SettlementResult processDefault(String borrower, String asset) {
        return boundary.execute("processDefault", () -> {
            GuaranteeRecord rec = requireActive(borrower, asset);
            long now = nowAfterStart(rec);
            if (now <= rec.getMaturityTime()) {
                HealthReport report = health.assess(rec.getBorrower());
                if (!report.isUnderCollateralized()) {
                    throw LedgerException.of(ErrorCode.GUARANTEE_NOT_DEFAULTABLE,
                            "guarantee " + rec.getId() + " is not overdue and borrower health factor is "
                                    + report.getHealthFactorBps() + " bps");
                }
                log.warn("[settlement] defaulting guarantee {} before maturity, hf={} degraded={}",
                        rec.getId(), report.getHealthFactorBps(), report.isDegraded());
            }

            store.markTerminal(rec.getId(), GuaranteeStatus.DEFAULTED);
            BigInteger forfeited = fund.forfeit(rec.getBorrower(), rec.getAsset());

            SettlementPlan plan = new SettlementPlan("processDefault#" + rec.getId())
                    .pay(rec.getAsset(), rec.getLender(), forfeited, "lender-forfeit");

            SettlementResult.SettlementResultBuilder result = SettlementResult.builder()
                    .guaranteeId(rec.getId())
                    .outcome(GuaranteeStatus.DEFAULTED)
                    .principal(rec.getPrincipal())
                    .actualInterestPaid(forfeited)
                    .penaltyToLender(BigInteger.ZERO)
                    .platformFee(BigInteger.ZERO)
                    .refundToBorrower(BigInteger.ZERO)
                    .lenderCompensation(forfeited)
                    .uncoveredPrincipal(rec.getPrincipal())
                    .debtReduced(BigInteger.ZERO);
            return finish(rec, plan, result);
        });
    }

    /**
     * Liquidates an under-collateralized user: reduces debt and seizes collateral, both clamped,
     * and sends the seized collateral to the liquidator.
     */
    public LiquidationResult processLiquidation(String liquidator, String user,
                                                String debtAsset, BigInteger debtAmount,
                                                String collateralAsset, BigInteger seizeAmount) {
        return boundary.execute("processLiquidation", () -> {
            String to = AddressUtil.requireNonZero(liquidator, "liquidator");
            FixedPointMath.requirePositive(debtAmount, "debtAmount");
            FixedPointMath.requireUint(seizeAmount, "seizeAmount");
            HealthReport report = health.assess(user);
            if (!report.isUnderCollateralized()) {
                throw LedgerException.of(ErrorCode.NOT_LIQUIDATABLE,
                        "health factor " + report.getHealthFactorBps() + " bps is not below "
                                + health.thresholds().getMinHealthFactorBps());
            }

            BigInteger reduced = ledger.recordForceReduceDebt(user, debtAsset, debtAmount);
            BigInteger seized = ledger.recordForceReduceCollateral(user, collateralAsset, seizeAmount);
            SettlementPlan plan = new SettlementPlan("processLiquidation")
                    .pay(AddressUtil.normalize(collateralAsset), to, seized, "liquidator")
                    .close();
            List<PlannedTransfer> issued = plan.issue(transfer);

            log.info("[settlement] liquidated user={} debtReduced={} {} seized={} {} hf={} degraded={}",
                    report.getUser(), reduced, debtAsset, seized, collateralAsset,
                    report.getHealthFactorBps(), report.isDegraded());
            return LiquidationResult.builder()
                    .user(report.getUser())
                    .debtAsset(AddressUtil.normalize(debtAsset))
                    .collateralAsset(AddressUtil.normalize(collateralAsset))
                    .debtReduced(reduced)
                    .collateralSeized(seized)
                    .healthFactorBefore(report.getHealthFactorBps())
                    .transfers(issued)
                    .build();
        });
    }

    // ----- governance -----

    public void setPlatformFeeRate(int bps) {
        boundary.run("setPlatformFeeRate", () -> {
            int old = settings.getPlatformFeeRateBps();
            settings.setPlatformFeeRateBps(bps);
            boundary.journal().recordUndo(() -> settings.setPlatformFeeRateBps(old));
            log.info("[settlement] platform fee rate {} -> {} bps", old, bps);
        });
    }

    public void setPlatformFeeReceiver(String receiver) {
        boundary.run("setPlatformFeeReceiver", () -> {
            String old = settings.getPlatformFeeReceiver();
            settings.setPlatformFeeReceiver(receiver);
            boundary.journal().recordUndo(() -> settings.setPlatformFeeReceiver(old));
            log.info("[settlement] platform fee receiver {} -> {}", old, settings.getPlatformFeeReceiver());
        });
    }

    public SettlementSettings settings() {
        return settings;
    }

    // ----- internals -----

    private GuaranteeRecord requireActive(String borrower, String asset) {
        return store.findActive(borrower, asset).orElseThrow(() -> {
            if (store.findLatest(borrower, asset).isPresent()) {
                return LedgerException.of(ErrorCode.GUARANTEE_NOT_ACTIVE,
                        "no active guarantee for borrower " + borrower + " and asset " + asset);
            }
            return LedgerException.of(ErrorCode.GUARANTEE_NOT_FOUND,
                    "no guarantee for borrower " + borrower + " and asset " + asset);
        });
    }

    private long nowAfterStart(GuaranteeRecord rec) {
        long now = clock.instant().getEpochSecond();
        if (now < rec.getStartTime()) {
            throw LedgerException.of(ErrorCode.CLOCK_BEFORE_START,
                    "clock " + now + " is before guarantee start " + rec.getStartTime());
        }
        return now;
    }

    private static void requireCovers(GuaranteeRecord rec, BigInteger actualRepayAmount) {
        FixedPointMath.requireUint(actualRepayAmount, "actualRepayAmount");
        if (actualRepayAmount.compareTo(rec.getPrincipal()) < 0) {
            throw LedgerException.of(ErrorCode.REPAYMENT_INSUFFICIENT,
                    "repayment " + actualRepayAmount + " does not cover principal " + rec.getPrincipal());
        }
    }

    /**
     * actualInterest = promised * actualDays / totalDays (single floor division);
     * penalty = min(shortfall, promised * penaltyDays / totalDays);
     * fee = (shortfall - penalty) * feeRate;
     * refund = shortfall - penalty - fee + (repay - principal).
     */
    private EarlyRepaymentBreakdown breakdown(GuaranteeRecord rec, BigInteger actualRepayAmount, long now) {
        long totalDays = rec.totalDays();
        long actualDays = Math.min((now - rec.getStartTime()) / FixedPointMath.SECONDS_PER_DAY, totalDays);
        BigInteger promised = rec.getPromisedInterest();
        BigInteger total = BigInteger.valueOf(totalDays);

        BigInteger actualInterest = FixedPointMath.mulDiv(promised, BigInteger.valueOf(actualDays), total);
        BigInteger shortfall = FixedPointMath.sub(promised, actualInterest);
        BigInteger penalty = FixedPointMath.min(shortfall,
                FixedPointMath.mulDiv(promised, BigInteger.valueOf(rec.getEarlyRepayPenaltyDays()), total));
        BigInteger afterPenalty = FixedPointMath.sub(shortfall, penalty);
        BigInteger fee = FixedPointMath.bps(afterPenalty, settings.getPlatformFeeRateBps());
        BigInteger refund = FixedPointMath.add(FixedPointMath.sub(afterPenalty, fee),
                FixedPointMath.sub(actualRepayAmount, rec.getPrincipal()));
        BigInteger toLender = FixedPointMath.add(FixedPointMath.add(rec.getPrincipal(), actualInterest), penalty);

        return EarlyRepaymentBreakdown.builder()
                .guaranteeId(rec.getId())
                .actualDays(actualDays)
                .totalDays(totalDays)
                .actualInterestPaid(actualInterest)
                .penaltyToLender(penalty)
                .platformFee(fee)
                .refundToBorrower(refund)
                .lenderCompensation(toLender)
                .build();
    }

    /** Publishes the terminated event, closes the plan and issues it. */
    private SettlementResult finish(GuaranteeRecord rec, SettlementPlan plan,
                                    SettlementResult.SettlementResultBuilder builder) {
        SettlementResult draft = builder.build();
        Instant at = clock.instant();
        boundary.journal().publish(GuaranteeTerminatedEvent.builder()
                .guaranteeId(rec.getId())
                .borrower(rec.getBorrower())
                .lender(rec.getLender())
                .asset(rec.getAsset())
                .outcome(draft.getOutcome())
                .actualInterestPaid(draft.getActualInterestPaid())
                .penaltyToLender(draft.getPenaltyToLender())
                .platformFee(draft.getPlatformFee())
                .refundToBorrower(draft.getRefundToBorrower())
                .lenderCompensation(draft.getLenderCompensation())
                .occurredAt(at)
                .build());

        List<PlannedTransfer> issued = plan.close().issue(transfer);
        log.info("[settlement] guarantee {} -> {} lender={} fee={} refund={} transfers={}",
                rec.getId(), draft.getOutcome(), draft.getLenderCompensation(), draft.getPlatformFee(),
                draft.getRefundToBorrower(), issued.size());
        return builder.transfers(issued).build();
    }
}
