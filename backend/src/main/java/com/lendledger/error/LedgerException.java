package com.lendledger.error;

/**
 * Single unchecked failure type of the ledger core. The {@link ErrorCode} says what went wrong,
 * its {@link ErrorCategory} says how the caller should react.
 */
public class LedgerException extends RuntimeException {

    private final ErrorCode code;

    public LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LedgerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public static LedgerException of(ErrorCode code, String message) {
        return new LedgerException(code, message);
    }
}
