package com.lendledger.ledger;

import lombok.Value;

import java.math.BigInteger;

/** Cached total debt value of a user in settlement-asset units. */
@Value
public class DebtValuation {
    public static final DebtValuation NONE = new DebtValuation(BigInteger.ZERO, false);

    BigInteger value;
    /** true when at least one asset was valued from a fallback or a stale last-valid value */
    boolean degraded;
}
