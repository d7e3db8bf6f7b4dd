package com.lendledger.settlement;

import com.lendledger.error.ErrorCode;
import com.lendledger.transfer.FundTransfer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.lendledger.support.LedgerAssertions.assertFailsWith;
import static com.lendledger.support.LedgerFixture.big;
import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SettlementPlanTest {

    private final FundTransfer transfer = mock(FundTransfer.class);

    @Test
    @DisplayName("an open plan cannot be issued")
    void openPlan() {
        SettlementPlan plan = new SettlementPlan("test").pay(USDC, BOB, big(1), "lender");

        assertFailsWith(ErrorCode.INTERACTION_BEFORE_EFFECTS, () -> plan.issue(transfer));
        verifyNoInteractions(transfer);
    }

    @Test
    @DisplayName("zero payments are skipped and nothing can be queued after close")
    void queueing() {
        SettlementPlan plan = new SettlementPlan("test")
                .pay(USDC, BOB, big(5), "lender")
                .pay(USDC, FEE_RECEIVER, BigInteger.ZERO, "platform-fee")
                .close();

        assertThat(plan.getQueued()).extracting(PlannedTransfer::getPurpose).containsExactly("lender");
        assertFailsWith(ErrorCode.INTERACTION_BEFORE_EFFECTS, () -> plan.pay(USDC, ALICE, big(1), "borrower-refund"));
        assertThat(plan.getQueued()).hasSize(1);
    }

    @Test
    @DisplayName("a plan is issued at most once, even after a failed attempt")
    void issuedOnce() {
        when(transfer.transfer(any(), any(), any())).thenReturn(false);
        SettlementPlan plan = new SettlementPlan("test").pay(USDC, BOB, big(5), "lender").close();

        assertFailsWith(ErrorCode.TRANSFER_FAILED, () -> plan.issue(transfer));
        assertFailsWith(ErrorCode.INTERACTION_BEFORE_EFFECTS, () -> plan.issue(transfer));

        verify(transfer, times(1)).transfer(USDC, BOB, big(5));
    }

    @Test
    @DisplayName("an empty plan cannot be issued twice either")
    void emptyPlanIssuedOnce() {
        SettlementPlan plan = new SettlementPlan("test").pay(USDC, BOB, BigInteger.ZERO, "lender").close();

        assertThat(plan.issue(transfer)).isEmpty();
        assertFailsWith(ErrorCode.INTERACTION_BEFORE_EFFECTS, () -> plan.issue(transfer));
        verifyNoInteractions(transfer);
    }

    @Test
    @DisplayName("issues in order and stops at the first failure")
    void stopsOnFailure() {
        when(transfer.transfer(any(), eq(BOB), any())).thenReturn(true);
        when(transfer.transfer(any(), eq(FEE_RECEIVER), any())).thenReturn(false);
        SettlementPlan plan = new SettlementPlan("test")
                .pay(USDC, BOB, big(5), "lender")
                .pay(USDC, FEE_RECEIVER, big(1), "platform-fee")
                .pay(USDC, ALICE, big(2), "borrower-refund")
                .close();

        assertFailsWith(ErrorCode.TRANSFER_FAILED, () -> plan.issue(transfer));

        verify(transfer).transfer(USDC, BOB, big(5));
        verify(transfer).transfer(USDC, FEE_RECEIVER, big(1));
        verify(transfer, never()).transfer(USDC, ALICE, big(2));
    }

    @Test
    @DisplayName("returns every issued transfer on success")
    void success() {
        when(transfer.transfer(any(), any(), any())).thenReturn(true);
        SettlementPlan plan = new SettlementPlan("test").pay(WETH, LIQUIDATOR, big(4), "liquidator").close();

        assertThat(plan.issue(transfer)).containsExactly(new PlannedTransfer(WETH, LIQUIDATOR, big(4), "liquidator"));
    }
}
