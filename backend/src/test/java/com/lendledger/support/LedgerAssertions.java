package com.lendledger.support;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import org.assertj.core.api.ThrowableAssert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public final class LedgerAssertions {
    private LedgerAssertions() {}

    /** Runs {@code call} and asserts it fails with a LedgerException carrying {@code code}. */
    public static LedgerException assertFailsWith(ErrorCode code, ThrowableAssert.ThrowingCallable call) {
        Throwable t = catchThrowable(call);
        assertThat(t).isInstanceOf(LedgerException.class);
        LedgerException e = (LedgerException) t;
        assertThat(e.getCode()).as("error code of: " + e.getMessage()).isEqualTo(code);
        return e;
    }
}
