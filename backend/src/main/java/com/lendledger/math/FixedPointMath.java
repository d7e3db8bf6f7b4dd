package com.lendledger.math;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;

import java.math.BigInteger;

/**
 * Checked uint256 arithmetic used by every amount, value and proportional calculation.
 *
 * Rules:
 *  - every operand and result must stay within [0, 2^256 - 1]; nothing wraps or saturates;
 *  - {@link #mulDiv(BigInteger, BigInteger, BigInteger)} rounds toward zero (floor for
 *    non-negative operands) and keeps the full product as intermediate, so no precision is
 *    lost before the single division.
 */
public final class FixedPointMath {
    private FixedPointMath() {}

    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /** Basis points: 10_000 = 100%. */
    public static final BigInteger BPS = BigInteger.valueOf(10_000);

    /** 1e18 fixed-point base. */
    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    public static final long SECONDS_PER_DAY = 86_400L;

    /** Fails unless {@code v} is a uint256. */
    public static BigInteger requireUint(BigInteger v, String name) {
        if (v == null) {
            throw LedgerException.of(ErrorCode.AMOUNT_OUT_OF_RANGE, name + " is null");
        }
        if (v.signum() < 0 || v.compareTo(UINT256_MAX) > 0) {
            throw LedgerException.of(ErrorCode.AMOUNT_OUT_OF_RANGE, name + " is not a uint256: " + v);
        }
        return v;
    }

    /** Fails unless {@code v} is a uint256 greater than zero. */
    public static BigInteger requirePositive(BigInteger v, String name) {
        requireUint(v, name);
        if (v.signum() == 0) {
            throw LedgerException.of(ErrorCode.AMOUNT_IS_ZERO, name + " must be greater than zero");
        }
        return v;
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(a.add(b), "add");
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        if (b.compareTo(a) > 0) {
            throw LedgerException.of(ErrorCode.UNDERFLOW, "sub underflow: " + a + " - " + b);
        }
        return a.subtract(b);
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        return checked(a.multiply(b), "mul");
    }

    /**
     * floor(a * b / c) with a full-width intermediate.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c) {
        if (c.signum() == 0) {
            throw LedgerException.of(ErrorCode.DIVISION_BY_ZERO, "mulDiv division by zero");
        }
        return checked(a.multiply(b).divide(c), "mulDiv");
    }

    /** amount * rateBps / 10_000, floored. */
    public static BigInteger bps(BigInteger amount, long rateBps) {
        return mulDiv(amount, BigInteger.valueOf(rateBps), BPS);
    }

    /** 10^decimals as a BigInteger. */
    public static BigInteger pow10(int decimals) {
        return BigInteger.TEN.pow(decimals);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isZero(BigInteger v) {
        return v == null || v.signum() == 0;
    }

    private static BigInteger checked(BigInteger r, String op) {
        if (r.signum() < 0) {
            throw LedgerException.of(ErrorCode.UNDERFLOW, op + " underflow");
        }
        if (r.compareTo(UINT256_MAX) > 0) {
            throw LedgerException.of(ErrorCode.OVERFLOW, op + " overflow");
        }
        return r;
    }
}
