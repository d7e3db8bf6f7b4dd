package com.lendledger.guarantee;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigInteger;

/**
 * Fixed-term obligation between a borrower and a lender. Retained after termination.
 * Times are epoch seconds.
 */
@Value
@Builder
@With
public class GuaranteeRecord {
    long id;
    String borrower;
    String lender;
    String asset;
    BigInteger principal;
    BigInteger promisedInterest;
    long startTime;
    long maturityTime;
    int earlyRepayPenaltyDays;
    GuaranteeStatus status;

    public boolean isActive() {
        return status == GuaranteeStatus.LOCKED;
    }

    /** Whole days between start and maturity, at least 1. */
    public long totalDays() {
        return Math.max(1L, (maturityTime - startTime) / 86_400L);
    }
}
