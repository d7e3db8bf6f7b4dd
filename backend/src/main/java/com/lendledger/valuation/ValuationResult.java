package com.lendledger.valuation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a valuation. Callers switch on {@link #getStatus()}; a raw feed number is never
 * handed out without one of these statuses attached.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValuationResult {

    public static final String REASON_ZERO_AMOUNT = "zero amount";
    public static final String REASON_OK = "price calculation successful";
    public static final String REASON_CALL_FAILED = "price oracle call failed";
    public static final String REASON_IMPLAUSIBLE = "price implausible";

    ValuationStatus status;
    BigInteger value;
    String reason;
    /** decimals of the price the value was computed from, 0 when no feed price was used */
    int decimals;

    public boolean isValid() {
        return status == ValuationStatus.ZERO
                || status == ValuationStatus.PRICED
                || status == ValuationStatus.DEGRADED;
    }

    public boolean isUsedFallback() {
        return status == ValuationStatus.DEGRADED || status == ValuationStatus.FAILED_CLOSED;
    }

    public static ValuationResult zero() {
        return new ValuationResult(ValuationStatus.ZERO, BigInteger.ZERO, REASON_ZERO_AMOUNT, 0);
    }

    public static ValuationResult priced(BigInteger value, int decimals) {
        return new ValuationResult(ValuationStatus.PRICED, value, REASON_OK, decimals);
    }

    public static ValuationResult degraded(BigInteger value, String reason, int decimals) {
        return new ValuationResult(ValuationStatus.DEGRADED, value, reason, decimals);
    }

    public static ValuationResult failedClosed(String reason) {
        return new ValuationResult(ValuationStatus.FAILED_CLOSED, BigInteger.ZERO, reason, 0);
    }

    public static ValuationResult rejected(String reason, int decimals) {
        return new ValuationResult(ValuationStatus.REJECTED, BigInteger.ZERO, reason, decimals);
    }
}
