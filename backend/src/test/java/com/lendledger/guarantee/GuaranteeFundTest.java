package com.lendledger.guarantee;

import com.lendledger.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lendledger.support.LedgerFixture.big;
import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;

class GuaranteeFundTest {

    private final GuaranteeFund fund = new LedgerFixture().fund;

    @Test
    @DisplayName("lock accumulates per user and per asset")
    void lock() {
        fund.lock(ALICE, USDC, big(100));
        fund.lock(ALICE, USDC, big(50));
        fund.lock(BOB, USDC, big(7));

        assertThat(fund.getLocked(ALICE, USDC)).isEqualTo(big(150));
        assertThat(fund.getTotalByAsset(USDC)).isEqualTo(big(157));
    }

    @Test
    @DisplayName("release clamps to the locked balance")
    void releaseClamps() {
        fund.lock(ALICE, USDC, big(100));

        assertThat(fund.release(ALICE, USDC, big(30))).isEqualTo(big(30));
        assertThat(fund.release(ALICE, USDC, big(500))).isEqualTo(big(70));
        assertThat(fund.getLocked(ALICE, USDC)).isZero();
        assertThat(fund.getTotalByAsset(USDC)).isZero();
    }

    @Test
    @DisplayName("forfeit takes everything and leaves other users alone")
    void forfeit() {
        fund.lock(ALICE, USDC, big(100));
        fund.lock(BOB, USDC, big(5));

        assertThat(fund.forfeit(ALICE, USDC)).isEqualTo(big(100));
        assertThat(fund.forfeit(ALICE, USDC)).isZero();
        assertThat(fund.getTotalByAsset(USDC)).isEqualTo(big(5));
    }
}
