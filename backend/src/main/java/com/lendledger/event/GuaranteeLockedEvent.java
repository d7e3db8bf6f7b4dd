package com.lendledger.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class GuaranteeLockedEvent implements LedgerEvent {
    long guaranteeId;
    String borrower;
    String lender;
    String asset;
    BigInteger principal;
    BigInteger promisedInterest;
    long startTime;
    long maturityTime;
    int earlyRepayPenaltyDays;
    Instant occurredAt;

    @Override
    public String getType() {
        return "GUARANTEE_LOCKED";
    }
}
