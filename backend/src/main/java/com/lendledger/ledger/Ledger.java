package com.lendledger.ledger;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.event.PositionChange;
import com.lendledger.event.PositionRecordedEvent;
import com.lendledger.math.FixedPointMath;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.util.AddressUtil;
import com.lendledger.valuation.DegradationConfig;
import com.lendledger.valuation.ValuationResult;
import com.lendledger.valuation.ValuationService;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative per-user, per-asset collateral and debt balances with asset-level aggregates.
 *
 * Every mutation runs inside the {@link OperationBoundary} and registers its undo action with the
 * journal, so a failure anywhere in the surrounding operation restores all maps below.
 * Maintained on every mutation:
 *  - sum of user debt per asset == totalDebtByAsset (same for collateral);
 *  - a position with both sides at zero is removed;
 *  - debtAssets / collateralAssets hold exactly the assets with a non-zero balance on that side.
 */
@Slf4j
public class Ledger {

    private record Key(String user, String asset) {}

    private final OperationBoundary boundary;
    private final ValuationService valuation;
    private final DegradationConfig debtConfig;
    private final Clock clock;

    private final Map<Key, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> totalDebtByAsset = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> totalCollateralByAsset = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> debtAssets = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> collateralAssets = new ConcurrentHashMap<>();
    private final Map<String, DebtValuation> debtValueCache = new ConcurrentHashMap<>();
    private final Map<Key, BigInteger> lastValidDebtValue = new ConcurrentHashMap<>();

    public Ledger(OperationBoundary boundary, ValuationService valuation, DegradationConfig debtConfig, Clock clock) {
        this.boundary = boundary;
        this.valuation = valuation;
        this.debtConfig = debtConfig.validate();
        this.clock = clock;
    }

    // ----- collateral side -----

    public void recordDeposit(String user, String asset, BigInteger amount) {
        boundary.run("recordDeposit", () -> {
            Key k = key(user, asset);
            FixedPointMath.requirePositive(amount, "amount");
            Position p = get(k);
            changeCollateral(k, p, FixedPointMath.add(p.getCollateral(), amount), PositionChange.DEPOSIT, amount);
        });
    }

    public void recordWithdraw(String user, String asset, BigInteger amount) {
        boundary.run("recordWithdraw", () -> {
            Key k = key(user, asset);
            FixedPointMath.requirePositive(amount, "amount");
            Position p = get(k);
            if (amount.compareTo(p.getCollateral()) > 0) {
                throw LedgerException.of(ErrorCode.INSUFFICIENT_COLLATERAL,
                        "withdraw " + amount + " exceeds collateral " + p.getCollateral());
            }
            changeCollateral(k, p, p.getCollateral().subtract(amount), PositionChange.WITHDRAW, amount);
        });
    }

    /**
     * Liquidation seize. Clamps to the available collateral.
     * @return the amount actually removed
     */
    public BigInteger recordForceReduceCollateral(String user, String asset, BigInteger amount) {
        return boundary.execute("recordForceReduceCollateral", () -> {
            Key k = key(user, asset);
            FixedPointMath.requireUint(amount, "amount");
            Position p = get(k);
            BigInteger seized = FixedPointMath.min(amount, p.getCollateral());
            if (seized.signum() == 0) return BigInteger.ZERO;
            changeCollateral(k, p, p.getCollateral().subtract(seized), PositionChange.SEIZE, seized);
            return seized;
        });
    }

    // ----- debt side -----

    public void recordBorrow(String user, String asset, BigInteger amount) {
        boundary.run("recordBorrow", () -> {
            Key k = key(user, asset);
            FixedPointMath.requirePositive(amount, "amount");
            Position p = get(k);
            changeDebt(k, p, FixedPointMath.add(p.getDebt(), amount), PositionChange.BORROW, amount);
        });
    }

    public void recordRepay(String user, String asset, BigInteger amount) {
        boundary.run("recordRepay", () -> {
            Key k = key(user, asset);
            FixedPointMath.requirePositive(amount, "amount");
            Position p = get(k);
            if (amount.compareTo(p.getDebt()) > 0) {
                throw LedgerException.of(ErrorCode.REPAY_EXCEEDS_DEBT,
                        "repay " + amount + " exceeds debt " + p.getDebt());
            }
            changeDebt(k, p, p.getDebt().subtract(amount), PositionChange.REPAY, amount);
        });
    }

    /**
     * Forced debt reduction (liquidation, guarantee settlement). Clamps to the outstanding debt.
     * @return the amount actually removed
     */
    public BigInteger recordForceReduceDebt(String user, String asset, BigInteger amount) {
        return boundary.execute("recordForceReduceDebt", () -> {
            Key k = key(user, asset);
            FixedPointMath.requireUint(amount, "amount");
            Position p = get(k);
            BigInteger reduced = FixedPointMath.min(amount, p.getDebt());
            if (reduced.signum() == 0) return BigInteger.ZERO;
            changeDebt(k, p, p.getDebt().subtract(reduced), PositionChange.FORCE_REDUCE_DEBT, reduced);
            return reduced;
        });
    }

    /**
     * Revalues every debt asset of the user and stores the total in the cache.
     * An invalid valuation reuses the last valid value of that asset, else the raw amount.
     */
    public DebtValuation refreshDebtValue(String user) {
        String u = AddressUtil.requireNonZero(user, "user");
        return boundary.execute("refreshDebtValue", () -> recomputeDebtValue(u));
    }

    // ----- reads -----

    public Position getPosition(String user, String asset) {
        Key k = key(user, asset);
        return boundary.read(() -> get(k));
    }

    public BigInteger getDebt(String user, String asset) {
        return getPosition(user, asset).getDebt();
    }

    public BigInteger getCollateral(String user, String asset) {
        return getPosition(user, asset).getCollateral();
    }

    public BigInteger getTotalDebtByAsset(String asset) {
        String a = AddressUtil.requireNonZero(asset, "asset");
        return boundary.read(() -> totalDebtByAsset.getOrDefault(a, BigInteger.ZERO));
    }

    public BigInteger getTotalCollateralByAsset(String asset) {
        String a = AddressUtil.requireNonZero(asset, "asset");
        return boundary.read(() -> totalCollateralByAsset.getOrDefault(a, BigInteger.ZERO));
    }

    public List<String> getDebtAssets(String user) {
        String u = AddressUtil.requireNonZero(user, "user");
        return boundary.read(() -> List.copyOf(debtAssets.getOrDefault(u, Set.of())));
    }

    public List<String> getCollateralAssets(String user) {
        String u = AddressUtil.requireNonZero(user, "user");
        return boundary.read(() -> List.copyOf(collateralAssets.getOrDefault(u, Set.of())));
    }

    /** Cached total debt value; zero when the user has no debt. */
    public BigInteger getTotalDebtValue(String user) {
        return getDebtValuation(user).getValue();
    }

    public DebtValuation getDebtValuation(String user) {
        String u = AddressUtil.requireNonZero(user, "user");
        return boundary.read(() -> debtValueCache.getOrDefault(u, DebtValuation.NONE));
    }

    // ----- internals -----

    private Key key(String user, String asset) {
        return new Key(AddressUtil.requireNonZero(user, "user"), AddressUtil.requireNonZero(asset, "asset"));
    }

    private Position get(Key k) {
        Position p = positions.get(k);
        return p != null ? p : Position.empty(k.user(), k.asset());
    }

    private void changeCollateral(Key k, Position p, BigInteger newBalance, PositionChange kind, BigInteger amount) {
        BigInteger total = totalCollateralByAsset.getOrDefault(k.asset(), BigInteger.ZERO);
        BigInteger newTotal = kind == PositionChange.DEPOSIT
                ? FixedPointMath.add(total, amount)
                : FixedPointMath.sub(total, amount);

        store(k, p.withCollateral(newBalance).withLastUpdated(clock.instant()));
        put(totalCollateralByAsset, k.asset(), newTotal);
        index(collateralAssets, k, newBalance.signum() > 0);

        boundary.journal().publish(PositionRecordedEvent.builder()
                .user(k.user()).asset(k.asset()).kind(kind).amount(amount)
                .balanceAfter(newBalance).totalAfter(newTotal)
                .occurredAt(clock.instant())
                .build());
    }

    private void changeDebt(Key k, Position p, BigInteger newBalance, PositionChange kind, BigInteger amount) {
        BigInteger total = totalDebtByAsset.getOrDefault(k.asset(), BigInteger.ZERO);
        BigInteger newTotal = kind == PositionChange.BORROW
                ? FixedPointMath.add(total, amount)
                : FixedPointMath.sub(total, amount);

        store(k, p.withDebt(newBalance).withLastUpdated(clock.instant()));
        put(totalDebtByAsset, k.asset(), newTotal);
        index(debtAssets, k, newBalance.signum() > 0);
        if (newBalance.signum() == 0) put(lastValidDebtValue, k, null);

        recomputeDebtValue(k.user());

        boundary.journal().publish(PositionRecordedEvent.builder()
                .user(k.user()).asset(k.asset()).kind(kind).amount(amount)
                .balanceAfter(newBalance).totalAfter(newTotal)
                .occurredAt(clock.instant())
                .build());
    }

    private DebtValuation recomputeDebtValue(String user) {
        Set<String> assets = debtAssets.getOrDefault(user, Set.of());
        if (assets.isEmpty()) {
            put(debtValueCache, user, null);
            return DebtValuation.NONE;
        }
        BigInteger total = BigInteger.ZERO;
        boolean degraded = false;
        for (String asset : assets) {
            Key k = new Key(user, asset);
            BigInteger debt = get(k).getDebt();
            ValuationResult r = valuation.getValue(asset, debt, debtConfig, "debtValue");
            BigInteger value;
            if (r.isValid()) {
                value = r.getValue();
                put(lastValidDebtValue, k, value);
            } else {
                value = lastValidDebtValue.getOrDefault(k, debt);
                log.warn("[ledger] debt valuation invalid user={} asset={} ({}), using {}", user, asset, r.getReason(), value);
            }
            degraded |= r.isUsedFallback() || !r.isValid();
            total = FixedPointMath.add(total, value);
        }
        DebtValuation dv = new DebtValuation(total, degraded);
        put(debtValueCache, user, dv);
        return dv;
    }

    private void store(Key k, Position p) {
        put(positions, k, p.isEmpty() ? null : p);
    }

    private void index(Map<String, Set<String>> idx, Key k, boolean present) {
        Set<String> cur = idx.getOrDefault(k.user(), Set.of());
        if (cur.contains(k.asset()) == present) return;
        Set<String> next = new LinkedHashSet<>(cur);
        if (present) next.add(k.asset()); else next.remove(k.asset());
        put(idx, k.user(), next.isEmpty() ? null : Collections.unmodifiableSet(next));
    }

    private <K, V> void put(Map<K, V> map, K key, V value) {
        boundary.journal().write(map, key, value);
    }
}
