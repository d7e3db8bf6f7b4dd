package com.lendledger.access;

/** Action ids checked through {@link AuthorizationCheck}. */
public final class LedgerActions {
    private LedgerActions() {}

    public static final String DEPOSIT = "ledger.deposit";
    public static final String WITHDRAW = "ledger.withdraw";
    public static final String BORROW = "ledger.borrow";
    public static final String REPAY = "ledger.repay";
    public static final String LIQUIDATE = "ledger.liquidate";
    public static final String LOCK_GUARANTEE = "guarantee.lock";
    public static final String SETTLE = "guarantee.settle";
    public static final String GOVERN = "settlement.govern";
}
