package com.lendledger.event;

/** Kind of a position mutation. */
public enum PositionChange {
    DEPOSIT(false),
    WITHDRAW(false),
    SEIZE(false),
    BORROW(true),
    REPAY(true),
    FORCE_REDUCE_DEBT(true);

    private final boolean debt;

    PositionChange(boolean debt) {
        this.debt = debt;
    }

    public boolean isDebt() {
        return debt;
    }
}
