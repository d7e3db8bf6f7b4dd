package com.lendledger.risk;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import lombok.Value;

@Value
public class RiskThresholds {
    /** below this the position is liquidatable */
    long minHealthFactorBps;
    /** borrow and withdraw must leave the position at or above this */
    long borrowHealthFactorBps;

    public RiskThresholds(long minHealthFactorBps, long borrowHealthFactorBps) {
        if (minHealthFactorBps < 10_000 || borrowHealthFactorBps < minHealthFactorBps) {
            throw LedgerException.of(ErrorCode.INVALID_CONFIG,
                    "need 10000 <= minHealthFactorBps <= borrowHealthFactorBps, got "
                            + minHealthFactorBps + "/" + borrowHealthFactorBps);
        }
        this.minHealthFactorBps = minHealthFactorBps;
        this.borrowHealthFactorBps = borrowHealthFactorBps;
    }
}
