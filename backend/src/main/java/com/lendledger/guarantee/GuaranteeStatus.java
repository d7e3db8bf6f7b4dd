package com.lendledger.guarantee;

/** Lifecycle of a guarantee. Only LOCKED is active; the others are terminal. */
public enum GuaranteeStatus {
    LOCKED,
    EARLY_REPAID,
    MATURED_REPAID,
    DEFAULTED;

    public boolean isTerminal() {
        return this != LOCKED;
    }
}
