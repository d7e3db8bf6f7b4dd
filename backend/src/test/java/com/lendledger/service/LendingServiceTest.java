package com.lendledger.service;

import com.lendledger.access.ConfiguredAuthorizationCheck;
import com.lendledger.access.LedgerActions;
import com.lendledger.config.AppProps;
import com.lendledger.error.ErrorCode;
import com.lendledger.guarantee.GuaranteeRecord;
import com.lendledger.guarantee.GuaranteeStatus;
import com.lendledger.ledger.Position;
import com.lendledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lendledger.support.LedgerAssertions.assertFailsWith;
import static com.lendledger.support.LedgerFixture.big;
import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LendingService")
class LendingServiceTest {

    private final LedgerFixture f = new LedgerFixture();
    private final AppProps props = new AppProps();
    private LendingService service;

    @BeforeEach
    void setUp() {
        for (String action : List.of(LedgerActions.DEPOSIT, LedgerActions.WITHDRAW, LedgerActions.BORROW,
                LedgerActions.REPAY, LedgerActions.LIQUIDATE, LedgerActions.LOCK_GUARANTEE, LedgerActions.SETTLE)) {
            props.getAccess().getClaims().put(action, List.of(ENGINE));
        }
        props.getAccess().getClaims().put(LedgerActions.GOVERN, List.of(GOVERNANCE));
        service = new LendingService(f.boundary, new ConfiguredAuthorizationCheck(props), f.ledger, f.health,
                f.store, f.settlement, f.valuation);
    }

    @Nested
    @DisplayName("claims")
    class Claims {

        @Test
        @DisplayName("a caller without the claim changes nothing")
        void missingClaim() {
            assertFailsWith(ErrorCode.MISSING_CLAIM, () -> service.deposit(BOB, ALICE, WETH, big(1)));
            assertFailsWith(ErrorCode.MISSING_CLAIM, () -> service.setPlatformFeeRate(ENGINE, 50));
            assertFailsWith(ErrorCode.MISSING_CLAIM, () -> service.deposit(null, ALICE, WETH, big(1)));

            assertThat(f.ledger.getCollateral(ALICE, WETH)).isZero();
            assertThat(f.settlement.settings().getPlatformFeeRateBps()).isEqualTo(100);
        }

        @Test
        @DisplayName("claims compare addresses case-insensitively")
        void caseInsensitive() {
            Position p = service.deposit(ENGINE.toUpperCase().replace("0X", "0x"), ALICE, WETH, big(1));

            assertThat(p.getCollateral()).isEqualTo(big(1));
        }

        @Test
        @DisplayName("enforcement can be switched off")
        void disabled() {
            props.getAccess().setEnforce(false);

            service.setPlatformFeeRate(BOB, 50);

            assertThat(f.settlement.settings().getPlatformFeeRateBps()).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("borrow and withdraw gate")
    class Gate {

        @BeforeEach
        void collateral() {
            service.deposit(ENGINE, ALICE, WETH, big(10));
        }

        @Test
        @DisplayName("a borrow that would drop below the borrow threshold is rolled back")
        void borrowTooMuch() {
            assertFailsWith(ErrorCode.HEALTH_FACTOR_TOO_LOW, () -> service.borrow(ENGINE, ALICE, USDC, big(17_000)));

            assertThat(f.ledger.getDebt(ALICE, USDC)).isZero();
            assertThat(f.ledger.getTotalDebtByAsset(USDC)).isZero();
        }

        @Test
        @DisplayName("a borrow that keeps the threshold goes through")
        void borrowOk() {
            Position p = service.borrow(ENGINE, ALICE, USDC, big(16_000));

            assertThat(p.getDebt()).isEqualTo(big(16_000));
            assertThat(service.healthFactor(ALICE).getHealthFactorBps()).isEqualTo(big(12_500));
        }

        @Test
        @DisplayName("a withdraw that would drop below the borrow threshold is rolled back")
        void withdrawGate() {
            service.borrow(ENGINE, ALICE, USDC, big(16_000));

            assertFailsWith(ErrorCode.HEALTH_FACTOR_TOO_LOW, () -> service.withdraw(ENGINE, ALICE, WETH, big(1)));
            assertThat(f.ledger.getCollateral(ALICE, WETH)).isEqualTo(big(10));

            service.repay(ENGINE, ALICE, USDC, big(16_000));
            assertThat(service.withdraw(ENGINE, ALICE, WETH, big(10)).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("guarantee lifecycle through the front door")
    void guaranteeLifecycle() {
        service.deposit(ENGINE, ALICE, WETH, big(1_000));
        service.borrow(ENGINE, ALICE, USDC, big(1_000_000));

        GuaranteeRecord rec = service.lockGuarantee(ENGINE, ALICE, BOB, USDC, big(1_000_000), big(50_000), 100);
        assertThat(service.getActiveGuaranteeIds(ALICE)).containsExactly(rec.getId());

        f.clock.advanceDays(40);
        assertThat(service.previewEarlyRepayment(rec.getId(), big(1_000_000)).getPlatformFee()).isEqualTo(big(290));
        service.earlyRepay(ENGINE, ALICE, USDC, big(1_000_000));

        assertThat(service.getGuarantee(rec.getId()).getStatus()).isEqualTo(GuaranteeStatus.EARLY_REPAID);
        assertThat(service.getPosition(ALICE, USDC).getDebt()).isZero();
        assertThat(f.sent).hasSize(3);
    }
}
