package com.lendledger.settlement;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.util.AddressUtil;

/**
 * Governance-owned settlement parameters. Changed only through {@link SettlementEngine} setters.
 */
public class SettlementSettings {

    public static final int MAX_PLATFORM_FEE_RATE_BPS = 1_000;
    public static final int DEFAULT_EARLY_REPAY_PENALTY_DAYS = 2;

    private volatile int platformFeeRateBps;
    private volatile String platformFeeReceiver;
    private final int earlyRepayPenaltyDays;

    public SettlementSettings(int platformFeeRateBps, String platformFeeReceiver, int earlyRepayPenaltyDays) {
        setPlatformFeeRateBps(platformFeeRateBps);
        setPlatformFeeReceiver(platformFeeReceiver);
        if (earlyRepayPenaltyDays < 0) {
            throw LedgerException.of(ErrorCode.INVALID_CONFIG, "earlyRepayPenaltyDays is negative: " + earlyRepayPenaltyDays);
        }
        this.earlyRepayPenaltyDays = earlyRepayPenaltyDays;
    }

    public int getPlatformFeeRateBps() {
        return platformFeeRateBps;
    }

    public String getPlatformFeeReceiver() {
        return platformFeeReceiver;
    }

    public int getEarlyRepayPenaltyDays() {
        return earlyRepayPenaltyDays;
    }

    void setPlatformFeeRateBps(int bps) {
        if (bps < 0 || bps > MAX_PLATFORM_FEE_RATE_BPS) {
            throw LedgerException.of(ErrorCode.RATE_TOO_HIGH,
                    "platform fee rate must be in [0, " + MAX_PLATFORM_FEE_RATE_BPS + "] bps: " + bps);
        }
        this.platformFeeRateBps = bps;
    }

    void setPlatformFeeReceiver(String receiver) {
        this.platformFeeReceiver = AddressUtil.requireNonZero(receiver, "platformFeeReceiver");
    }
}
