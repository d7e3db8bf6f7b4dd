package com.lendledger.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-distinguishable error kinds returned by the ledger core.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // validation
    ZERO_ADDRESS(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    AMOUNT_IS_ZERO(ErrorCategory.VALIDATION),
    AMOUNT_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    BORROWER_IS_LENDER(ErrorCategory.VALIDATION),
    TERM_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    INTEREST_TOO_HIGH(ErrorCategory.VALIDATION),
    RATE_TOO_HIGH(ErrorCategory.VALIDATION),
    INVALID_CONFIG(ErrorCategory.VALIDATION),
    REPAY_EXCEEDS_DEBT(ErrorCategory.VALIDATION),
    INSUFFICIENT_COLLATERAL(ErrorCategory.VALIDATION),
    HEALTH_FACTOR_TOO_LOW(ErrorCategory.VALIDATION),
    NOT_LIQUIDATABLE(ErrorCategory.VALIDATION),

    // arithmetic
    OVERFLOW(ErrorCategory.ARITHMETIC),
    UNDERFLOW(ErrorCategory.ARITHMETIC),
    DIVISION_BY_ZERO(ErrorCategory.ARITHMETIC),
    GUARANTEE_ID_EXHAUSTED(ErrorCategory.ARITHMETIC),

    // authorization
    MISSING_CLAIM(ErrorCategory.AUTHORIZATION),

    // settlement integrity
    GUARANTEE_NOT_FOUND(ErrorCategory.SETTLEMENT_INTEGRITY),
    GUARANTEE_NOT_ACTIVE(ErrorCategory.SETTLEMENT_INTEGRITY),
    GUARANTEE_ALREADY_ACTIVE(ErrorCategory.SETTLEMENT_INTEGRITY),
    GUARANTEE_MATURED(ErrorCategory.SETTLEMENT_INTEGRITY),
    GUARANTEE_NOT_MATURED(ErrorCategory.SETTLEMENT_INTEGRITY),
    GUARANTEE_NOT_DEFAULTABLE(ErrorCategory.SETTLEMENT_INTEGRITY),
    REPAYMENT_INSUFFICIENT(ErrorCategory.SETTLEMENT_INTEGRITY),
    CLOCK_BEFORE_START(ErrorCategory.SETTLEMENT_INTEGRITY),
    INTERACTION_BEFORE_EFFECTS(ErrorCategory.SETTLEMENT_INTEGRITY),

    // transfer
    TRANSFER_FAILED(ErrorCategory.TRANSFER);

    private final ErrorCategory category;
}
