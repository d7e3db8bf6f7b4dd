package com.lendledger.guarantee;

import com.lendledger.error.ErrorCode;
import com.lendledger.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.lendledger.support.LedgerAssertions.assertFailsWith;
import static com.lendledger.support.LedgerFixture.big;
import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GuaranteeStore")
class GuaranteeStoreTest {

    private final LedgerFixture f = new LedgerFixture();
    private final GuaranteeStore store = f.store;

    private long lockDefault() {
        return store.lock(ALICE, BOB, USDC, big(1_000_000), big(50_000), 100, 2);
    }

    @Nested
    @DisplayName("lock")
    class Lock {

        @Test
        @DisplayName("stores a LOCKED record and indexes it")
        void stores() {
            long id = lockDefault();

            GuaranteeRecord rec = store.get(id);
            assertThat(id).isEqualTo(1L);
            assertThat(rec.getStatus()).isEqualTo(GuaranteeStatus.LOCKED);
            assertThat(rec.getStartTime()).isEqualTo(LedgerFixture.T0.getEpochSecond());
            assertThat(rec.getMaturityTime() - rec.getStartTime()).isEqualTo(100 * 86_400L);
            assertThat(rec.totalDays()).isEqualTo(100);
            assertThat(store.hasActiveGuarantee(ALICE, USDC)).isTrue();
            assertThat(store.getActiveGuaranteeId(ALICE, USDC)).isEqualTo(id);
            assertThat(store.getActiveGuaranteeIds(ALICE)).containsExactly(id);
        }

        @Test
        @DisplayName("ids grow and one active record per borrower and asset")
        void onePerPair() {
            long first = lockDefault();
            long second = store.lock(ALICE, BOB, WETH, big(10), big(1), 30, 2);

            assertThat(second).isEqualTo(first + 1);
            assertThat(store.getActiveGuaranteeIds(ALICE)).containsExactly(first, second);
            assertFailsWith(ErrorCode.GUARANTEE_ALREADY_ACTIVE, GuaranteeStoreTest.this::lockDefault);
        }

        @Test
        @DisplayName("rejects invalid terms")
        void validation() {
            var e = assertFailsWith(ErrorCode.BORROWER_IS_LENDER,
                    () -> store.lock(ALICE, ALICE, USDC, big(1), big(0), 10, 2));
            assertThat(e.getMessage()).contains("borrower cannot be lender");
            assertFailsWith(ErrorCode.AMOUNT_IS_ZERO, () -> store.lock(ALICE, BOB, USDC, BigInteger.ZERO, big(0), 10, 2));
            assertFailsWith(ErrorCode.INTEREST_TOO_HIGH, () -> store.lock(ALICE, BOB, USDC, big(100), big(201), 10, 2));
            assertFailsWith(ErrorCode.TERM_OUT_OF_RANGE, () -> store.lock(ALICE, BOB, USDC, big(100), big(1), 0, 2));
            assertFailsWith(ErrorCode.TERM_OUT_OF_RANGE,
                    () -> store.lock(ALICE, BOB, USDC, big(100), big(1), GuaranteeStore.MAX_TERM_DAYS + 1, 2));
            assertFailsWith(ErrorCode.ZERO_ADDRESS,
                    () -> store.lock(ALICE, "0x0000000000000000000000000000000000000000", USDC, big(100), big(1), 10, 2));

            assertThat(store.hasActiveGuarantee(ALICE, USDC)).isFalse();
            assertThat(store.lock(ALICE, BOB, USDC, big(100), big(200), GuaranteeStore.MAX_TERM_DAYS, 2)).isEqualTo(1L);
        }

        @Test
        @DisplayName("a saturated id counter refuses new records")
        void saturation() {
            GuaranteeStore nearlyFull = new GuaranteeStore(f.boundary, f.clock, Long.MAX_VALUE - 1);

            long last = nearlyFull.lock(ALICE, BOB, USDC, big(1), big(0), 10, 2);

            assertThat(last).isEqualTo(Long.MAX_VALUE - 1);
            assertFailsWith(ErrorCode.GUARANTEE_ID_EXHAUSTED,
                    () -> nearlyFull.lock(ALICE, BOB, WETH, big(1), big(0), 10, 2));
        }
    }

    @Nested
    @DisplayName("markTerminal")
    class MarkTerminal {

        @Test
        @DisplayName("terminates once and frees the pair")
        void once() {
            long id = lockDefault();

            GuaranteeRecord closed = store.markTerminal(id, GuaranteeStatus.EARLY_REPAID);

            assertThat(closed.getStatus()).isEqualTo(GuaranteeStatus.EARLY_REPAID);
            assertThat(store.get(id).isActive()).isFalse();
            assertThat(store.findActive(ALICE, USDC)).isEmpty();
            assertThat(store.findLatest(ALICE, USDC)).get().extracting(GuaranteeRecord::getId).isEqualTo(id);
            assertThat(store.getActiveGuaranteeId(ALICE, USDC)).isZero();
            assertThat(store.getActiveGuaranteeIds(ALICE)).isEmpty();
            assertFailsWith(ErrorCode.GUARANTEE_NOT_ACTIVE, () -> store.markTerminal(id, GuaranteeStatus.DEFAULTED));
        }

        @Test
        @DisplayName("a new guarantee can follow a terminated one")
        void relock() {
            long id = lockDefault();
            store.markTerminal(id, GuaranteeStatus.MATURED_REPAID);

            long next = lockDefault();

            assertThat(next).isNotEqualTo(id);
            assertThat(store.get(id).getStatus()).isEqualTo(GuaranteeStatus.MATURED_REPAID);
        }

        @Test
        @DisplayName("LOCKED is not a terminal outcome and unknown ids are not found")
        void invalid() {
            long id = lockDefault();

            assertFailsWith(ErrorCode.INVALID_CONFIG, () -> store.markTerminal(id, GuaranteeStatus.LOCKED));
            assertFailsWith(ErrorCode.GUARANTEE_NOT_FOUND, () -> store.markTerminal(99, GuaranteeStatus.DEFAULTED));
            assertFailsWith(ErrorCode.GUARANTEE_NOT_FOUND, () -> store.get(99));
        }
    }

    @Test
    @DisplayName("a rolled back lock leaves the id counter untouched")
    void rollbackRestoresCounter() {
        try {
            f.boundary.run("test", () -> {
                lockDefault();
                throw new IllegalStateException("abort");
            });
        } catch (IllegalStateException expected) {
            // rolled back
        }

        assertThat(store.hasActiveGuarantee(ALICE, USDC)).isFalse();
        assertThat(lockDefault()).isEqualTo(1L);
    }
}
