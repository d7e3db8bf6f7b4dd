package com.lendledger.guarantee;

import com.lendledger.math.FixedPointMath;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.util.AddressUtil;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Escrow of promised interest per (user, asset). Release and forfeit clamp to what is locked.
 */
public class GuaranteeFund {

    private record Key(String user, String asset) {}

    private final OperationBoundary boundary;
    private final Map<Key, BigInteger> locked = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> totalByAsset = new ConcurrentHashMap<>();

    public GuaranteeFund(OperationBoundary boundary) {
        this.boundary = boundary;
    }

    public void lock(String user, String asset, BigInteger amount) {
        boundary.run("fundLock", () -> {
            Key k = key(user, asset);
            FixedPointMath.requireUint(amount, "amount");
            if (amount.signum() == 0) return;
            set(k, FixedPointMath.add(getLocked(k), amount));
            setTotal(k.asset(), FixedPointMath.add(total(k.asset()), amount));
        });
    }

    /** @return the amount actually released, at most the locked balance */
    public BigInteger release(String user, String asset, BigInteger amount) {
        return boundary.execute("fundRelease", () -> {
            Key k = key(user, asset);
            FixedPointMath.requireUint(amount, "amount");
            return take(k, FixedPointMath.min(amount, getLocked(k)));
        });
    }

    /** Takes the whole locked balance away from the user. @return the forfeited amount */
    public BigInteger forfeit(String user, String asset) {
        return boundary.execute("fundForfeit", () -> {
            Key k = key(user, asset);
            return take(k, getLocked(k));
        });
    }

    public BigInteger getLocked(String user, String asset) {
        Key k = key(user, asset);
        return boundary.read(() -> getLocked(k));
    }

    public BigInteger getTotalByAsset(String asset) {
        String a = AddressUtil.requireNonZero(asset, "asset");
        return boundary.read(() -> total(a));
    }

    private BigInteger take(Key k, BigInteger amount) {
        if (amount.signum() == 0) return BigInteger.ZERO;
        set(k, FixedPointMath.sub(getLocked(k), amount));
        setTotal(k.asset(), FixedPointMath.sub(total(k.asset()), amount));
        return amount;
    }

    private BigInteger getLocked(Key k) {
        return locked.getOrDefault(k, BigInteger.ZERO);
    }

    private BigInteger total(String asset) {
        return totalByAsset.getOrDefault(asset, BigInteger.ZERO);
    }

    private void set(Key k, BigInteger v) {
        boundary.journal().write(locked, k, v.signum() == 0 ? null : v);
    }

    private void setTotal(String asset, BigInteger v) {
        boundary.journal().write(totalByAsset, asset, v.signum() == 0 ? null : v);
    }

    private Key key(String user, String asset) {
        return new Key(AddressUtil.requireNonZero(user, "user"), AddressUtil.requireNonZero(asset, "asset"));
    }
}
