package com.lendledger.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Per (user, asset) balances. A position with both sides zero is never stored.
 */
@Value
@Builder
@With
public class Position {
    String user;
    String asset;
    BigInteger collateral;
    BigInteger debt;
    Instant lastUpdated;

    public static Position empty(String user, String asset) {
        return new Position(user, asset, BigInteger.ZERO, BigInteger.ZERO, null);
    }

    public boolean isEmpty() {
        return collateral.signum() == 0 && debt.signum() == 0;
    }
}
