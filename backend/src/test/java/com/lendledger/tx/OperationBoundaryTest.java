package com.lendledger.tx;

import com.lendledger.event.PositionRecordedEvent;
import com.lendledger.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.lendledger.support.LedgerFixture.big;
import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("OperationBoundary")
class OperationBoundaryTest {

    private final LedgerFixture f = new LedgerFixture();

    @Test
    @DisplayName("a failing operation undoes every change and publishes nothing")
    void rollsBackEverything() {
        assertThatThrownBy(() -> f.boundary.run("test", () -> {
            f.ledger.recordDeposit(ALICE, WETH, big(5));
            f.ledger.recordBorrow(ALICE, USDC, big(100));
            throw new IllegalStateException("boom");
        })).hasMessage("boom");

        assertThat(f.ledger.getPosition(ALICE, WETH).isEmpty()).isTrue();
        assertThat(f.ledger.getTotalCollateralByAsset(WETH)).isZero();
        assertThat(f.ledger.getTotalDebtByAsset(USDC)).isZero();
        assertThat(f.ledger.getDebtAssets(ALICE)).isEmpty();
        assertThat(f.ledger.getTotalDebtValue(ALICE)).isZero();
        assertThat(f.events.all()).isEmpty();
        assertThat(f.boundary.inOperation()).isFalse();
    }

    @Test
    @DisplayName("a nested failure only undoes the nested changes")
    void nestedSavepoint() {
        f.boundary.run("outer", () -> {
            f.ledger.recordDeposit(ALICE, WETH, big(5));
            try {
                f.boundary.run("inner", () -> {
                    f.ledger.recordDeposit(ALICE, WETH, big(7));
                    throw new IllegalStateException("inner failed");
                });
            } catch (IllegalStateException expected) {
                assertThat(f.ledger.getCollateral(ALICE, WETH)).isEqualTo(big(5));
            }
        });

        assertThat(f.ledger.getCollateral(ALICE, WETH)).isEqualTo(big(5));
        assertThat(f.events.ofType(PositionRecordedEvent.class)).hasSize(1);
    }

    @Test
    @DisplayName("events are held back until the outermost operation commits")
    void eventsBufferedUntilCommit() {
        BigInteger seenInside = f.boundary.execute("outer", () -> {
            f.ledger.recordDeposit(ALICE, WETH, big(5));
            assertThat(f.events.all()).isEmpty();
            assertThat(f.boundary.inOperation()).isTrue();
            return f.ledger.getCollateral(ALICE, WETH);
        });

        assertThat(seenInside).isEqualTo(big(5));
        assertThat(f.events.ofType(PositionRecordedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.getType()).isEqualTo("COLLATERAL_RECORDED"));
    }

    @Test
    @DisplayName("a read from another thread waits until the open operation commits")
    void readsWaitForCommit() throws Exception {
        CountDownLatch written = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = pool.submit(() -> f.boundary.run("slow", () -> {
                f.ledger.recordDeposit(ALICE, WETH, big(5));
                written.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(written.await(5, TimeUnit.SECONDS)).isTrue();

            Future<BigInteger> reader = pool.submit(() -> f.ledger.getTotalCollateralByAsset(WETH));
            assertThatThrownBy(() -> reader.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            release.countDown();
            writer.get(5, TimeUnit.SECONDS);
            assertThat(reader.get(5, TimeUnit.SECONDS)).isEqualTo(big(5));
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
