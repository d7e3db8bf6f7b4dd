package com.lendledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/** Split of an early repayment. Computed identically for preview and settlement. */
@Value
@Builder
public class EarlyRepaymentBreakdown {
    long guaranteeId;
    long actualDays;
    long totalDays;
    BigInteger actualInterestPaid;
    BigInteger penaltyToLender;
    BigInteger platformFee;
    BigInteger refundToBorrower;
    /** principal + actualInterestPaid + penaltyToLender */
    BigInteger lenderCompensation;
}
