package com.lendledger.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/** Debt-recorded / collateral-recorded signal. */
@Value
@Builder
public class PositionRecordedEvent implements LedgerEvent {
    String user;
    String asset;
    PositionChange kind;
    BigInteger amount;
    /** user balance on the changed side after the mutation */
    BigInteger balanceAfter;
    /** asset-level aggregate on the changed side after the mutation */
    BigInteger totalAfter;
    Instant occurredAt;

    @Override
    public String getType() {
        return kind.isDebt() ? "DEBT_RECORDED" : "COLLATERAL_RECORDED";
    }
}
