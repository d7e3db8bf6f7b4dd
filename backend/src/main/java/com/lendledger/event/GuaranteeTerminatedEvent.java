package com.lendledger.event;

import com.lendledger.guarantee.GuaranteeStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/** Emitted once per guarantee, when it reaches a terminal state. */
@Value
@Builder
public class GuaranteeTerminatedEvent implements LedgerEvent {
    long guaranteeId;
    String borrower;
    String lender;
    String asset;
    GuaranteeStatus outcome;
    BigInteger actualInterestPaid;
    BigInteger penaltyToLender;
    BigInteger platformFee;
    BigInteger refundToBorrower;
    BigInteger lenderCompensation;
    Instant occurredAt;

    @Override
    public String getType() {
        return "GUARANTEE_TERMINATED";
    }
}
