package com.lendledger.error;

/**
 * Coarse classes of failure. Front doors use the category to decide whether to retry,
 * surface the problem to a human or treat it as permanent.
 */
public enum ErrorCategory {
    /** Bad input; nothing was mutated and the caller must fix the request. */
    VALIDATION,
    /** Overflow, underflow or a tripped division guard; fatal to the call. */
    ARITHMETIC,
    /** Missing claim for the requested action. */
    AUTHORIZATION,
    /** Settlement state does not allow the operation; the whole call was rolled back. */
    SETTLEMENT_INTEGRITY,
    /** An external fund transfer failed; the whole call was rolled back. */
    TRANSFER
}
