package com.lendledger.valuation;

/** How a valuation value came about. */
public enum ValuationStatus {
    /** amount was zero; the feed was not called */
    ZERO,
    /** validated feed price */
    PRICED,
    /** feed unusable, conservative fallback value */
    DEGRADED,
    /** feed unusable and no fallback applies */
    FAILED_CLOSED,
    /** feed answer structurally invalid (decimals); no fallback attempted */
    REJECTED
}
