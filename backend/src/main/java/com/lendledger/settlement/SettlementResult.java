package com.lendledger.settlement;

import com.lendledger.guarantee.GuaranteeStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
@Builder
public class SettlementResult {
    long guaranteeId;
    GuaranteeStatus outcome;
    BigInteger principal;
    BigInteger actualInterestPaid;
    BigInteger penaltyToLender;
    BigInteger platformFee;
    BigInteger refundToBorrower;
    /** everything paid to the lender by this settlement */
    BigInteger lenderCompensation;
    /** principal the lender is not paid back here (default only) */
    BigInteger uncoveredPrincipal;
    BigInteger debtReduced;
    List<PlannedTransfer> transfers;
}
