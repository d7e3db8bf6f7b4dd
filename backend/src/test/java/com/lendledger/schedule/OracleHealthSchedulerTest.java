package com.lendledger.schedule;

import com.lendledger.config.AppProps;
import com.lendledger.event.OracleHealthChangedEvent;
import com.lendledger.support.RecordingPublisher;
import com.lendledger.valuation.OracleHealth;
import com.lendledger.valuation.PriceFeedRegistry;
import com.lendledger.valuation.ValuationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.*;

class OracleHealthSchedulerTest {

    private final ValuationService valuation = mock(ValuationService.class);
    private final RecordingPublisher events = new RecordingPublisher();
    private final AppProps props = new AppProps();
    private final OracleHealthScheduler scheduler =
            new OracleHealthScheduler(valuation, new PriceFeedRegistry(), events, props);

    private static OracleHealth health(String asset, boolean healthy) {
        return OracleHealth.builder()
                .asset(asset)
                .healthy(healthy)
                .details(healthy ? OracleHealth.HEALTHY : "Price is stale")
                .checkedAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("reports unhealthy oracles on first sight and every flip afterwards")
    void flips() {
        List<String> assets = List.of(USDC, WETH);
        when(valuation.checkPriceOracleHealthBatch(assets))
                .thenReturn(List.of(health(USDC, true), health(WETH, false)))
                .thenReturn(List.of(health(USDC, true), health(WETH, false)))
                .thenReturn(List.of(health(USDC, false), health(WETH, true)));

        assertThat(scheduler.probe(assets)).extracting(OracleHealth::getAsset).containsExactly(WETH);
        assertThat(scheduler.probe(assets)).isEmpty();
        assertThat(scheduler.probe(assets)).extracting(OracleHealth::getAsset).containsExactly(USDC, WETH);

        assertThat(events.ofType(OracleHealthChangedEvent.class))
                .extracting(OracleHealthChangedEvent::getAsset, OracleHealthChangedEvent::isHealthy)
                .containsExactly(
                        tuple(WETH, false),
                        tuple(USDC, false),
                        tuple(WETH, true));
    }

    @Test
    @DisplayName("probes the configured asset list when one is set")
    void configuredAssets() {
        props.getHealth().setAssets(List.of(WETH));
        when(valuation.checkPriceOracleHealthBatch(List.of(WETH))).thenReturn(List.of(health(WETH, true)));

        scheduler.run();

        verify(valuation).checkPriceOracleHealthBatch(List.of(WETH));
        assertThat(events.all()).isEmpty();
    }
}
