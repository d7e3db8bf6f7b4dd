package com.lendledger.schedule;

import com.lendledger.config.AppProps;
import com.lendledger.event.LedgerEventPublisher;
import com.lendledger.event.OracleHealthChangedEvent;
import com.lendledger.valuation.OracleHealth;
import com.lendledger.valuation.PriceFeedRegistry;
import com.lendledger.valuation.ValuationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probes the configured oracles (all registered feeds when none are listed) and publishes
 * {@link OracleHealthChangedEvent} when an asset flips between healthy and unhealthy.
 * An asset seen for the first time is only reported when it is unhealthy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleHealthScheduler {

    private final ValuationService valuation;
    private final PriceFeedRegistry feeds;
    private final LedgerEventPublisher events;
    private final AppProps props;

    /** asset -> last observed health */
    private final Map<String, Boolean> lastHealthy = new ConcurrentHashMap<>();

    @Scheduled(cron = "${app.health.cron:0 */5 * * * ?}")
    public void run() {
        List<String> assets = props.getHealth().getAssets().isEmpty()
                ? new ArrayList<>(feeds.assets())
                : props.getHealth().getAssets();
        log.info("[oracle-health] probing {} assets", assets.size());
        probe(assets);
    }

    /** @return the entries whose health changed in this round */
    List<OracleHealth> probe(List<String> assets) {
        List<OracleHealth> changed = new ArrayList<>();
        for (OracleHealth h : valuation.checkPriceOracleHealthBatch(assets)) {
            String key = String.valueOf(h.getAsset());
            Boolean before = lastHealthy.put(key, h.isHealthy());
            boolean report = before == null ? !h.isHealthy() : before != h.isHealthy();
            if (!report) continue;

            changed.add(h);
            if (h.isHealthy()) {
                log.info("[oracle-health] asset={} recovered", key);
            } else {
                log.warn("[oracle-health] asset={} unhealthy: {}", key, h.getDetails());
            }
            events.publish(OracleHealthChangedEvent.builder()
                    .asset(key)
                    .healthy(h.isHealthy())
                    .details(h.getDetails())
                    .occurredAt(h.getCheckedAt())
                    .build());
        }
        return changed;
    }
}
