package com.lendledger.config;

import com.lendledger.event.LedgerEventPublisher;
import com.lendledger.guarantee.GuaranteeFund;
import com.lendledger.guarantee.GuaranteeStore;
import com.lendledger.ledger.Ledger;
import com.lendledger.risk.HealthFactorService;
import com.lendledger.risk.RiskThresholds;
import com.lendledger.settlement.SettlementEngine;
import com.lendledger.settlement.SettlementSettings;
import com.lendledger.transfer.DryRunFundTransfer;
import com.lendledger.transfer.FundTransfer;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.tx.StateJournal;
import com.lendledger.valuation.DegradationConfig;
import com.lendledger.valuation.GracefulValuationService;
import com.lendledger.valuation.LastKnownPriceCache;
import com.lendledger.valuation.PriceFeedRegistry;
import com.lendledger.valuation.ValidationConfig;
import com.lendledger.valuation.ValuationService;
import com.lendledger.web3.ChainlinkPriceFeed;
import com.lendledger.web3.Erc20FundTransfer;
import com.lendledger.web3.HttpPriceFeed;
import com.lendledger.web3.Web3ClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * Assembles the ledger core once. Every engine gets typed handles to its collaborators.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StateJournal stateJournal(LedgerEventPublisher publisher) {
        return new StateJournal(publisher);
    }

    @Bean
    public OperationBoundary operationBoundary(StateJournal journal) {
        return new OperationBoundary(journal);
    }

    @Bean
    public PriceFeedRegistry priceFeedRegistry(AppProps props, Web3ClientFactory web3,
                                               @Qualifier("priceApiRestTemplate") RestTemplate priceApi,
                                               Clock clock) {
        PriceFeedRegistry registry = new PriceFeedRegistry();
        for (Map.Entry<String, AppProps.Feed> e : props.getFeeds().entrySet()) {
            AppProps.Feed f = e.getValue();
            switch (f.getType().toLowerCase(Locale.ROOT)) {
                case "chainlink" -> registry.register(e.getKey(), new ChainlinkPriceFeed(web3, f.getNetwork(), f.getAggregator()));
                case "http" -> registry.register(e.getKey(), new HttpPriceFeed(priceApi, f.getUrl(), f.getPriceField(), f.getDecimals(), clock));
                default -> throw new IllegalArgumentException("Unknown feed type '" + f.getType() + "' for " + e.getKey());
            }
        }
        log.info("Registered price feeds for {} assets", registry.assets().size());
        return registry;
    }

    @Bean
    public LastKnownPriceCache lastKnownPriceCache() {
        return new LastKnownPriceCache();
    }

    @Bean
    public ValidationConfig validationConfig(AppProps props) {
        AppProps.Validation v = props.getValuation().getValidation();
        return ValidationConfig.builder()
                .minMultiplierBps(v.getMinMultiplierBps())
                .maxMultiplierBps(v.getMaxMultiplierBps())
                .maxReasonablePrice(v.getMaxReasonablePrice())
                .maxPriceAgeSeconds(v.getMaxPriceAgeSeconds())
                .build();
    }

    @Bean
    @Qualifier("collateralDegradation")
    public DegradationConfig collateralDegradation(AppProps props) {
        return degradation(props, props.getValuation().getCollateral());
    }

    @Bean
    @Qualifier("debtDegradation")
    public DegradationConfig debtDegradation(AppProps props) {
        return degradation(props, props.getValuation().getDebt());
    }

    @Bean
    public ValuationService valuationService(PriceFeedRegistry feeds, LastKnownPriceCache cache,
                                             ValidationConfig validation, LedgerEventPublisher publisher,
                                             Clock clock) {
        return new GracefulValuationService(feeds, cache, validation, publisher, clock);
    }

    @Bean
    public Ledger ledger(OperationBoundary boundary, ValuationService valuation,
                         @Qualifier("debtDegradation") DegradationConfig debtConfig, Clock clock) {
        return new Ledger(boundary, valuation, debtConfig, clock);
    }

    @Bean
    public HealthFactorService healthFactorService(OperationBoundary boundary, Ledger ledger, ValuationService valuation,
                                                   @Qualifier("collateralDegradation") DegradationConfig collateralConfig,
                                                   AppProps props) {
        AppProps.Risk r = props.getRisk();
        return new HealthFactorService(boundary, ledger, valuation, collateralConfig,
                new RiskThresholds(r.getMinHealthFactorBps(), r.getBorrowHealthFactorBps()));
    }

    @Bean
    public GuaranteeStore guaranteeStore(OperationBoundary boundary, Clock clock) {
        return new GuaranteeStore(boundary, clock);
    }

    @Bean
    public GuaranteeFund guaranteeFund(OperationBoundary boundary) {
        return new GuaranteeFund(boundary);
    }

    @Bean
    public FundTransfer fundTransfer(AppProps props, Web3ClientFactory web3) {
        AppProps.Transfer t = props.getTransfer();
        if ("erc20".equalsIgnoreCase(t.getMode())) {
            AppProps.Network net = props.require(t.getNetwork());
            log.info("Fund transfers: erc20 on {} (chainId={})", t.getNetwork(), net.getChainId());
            return new Erc20FundTransfer(web3, t.getNetwork(), Long.parseLong(net.getChainId()), t.getPrivateKey(),
                    t.getGasPrice(), t.getGasLimit(), t.getReceiptTimeoutSeconds());
        }
        log.info("Fund transfers: dry-run");
        return new DryRunFundTransfer();
    }

    @Bean
    public SettlementEngine settlementEngine(OperationBoundary boundary, GuaranteeStore store, GuaranteeFund fund,
                                             Ledger ledger, HealthFactorService health, FundTransfer transfer,
                                             AppProps props, Clock clock) {
        AppProps.Settlement s = props.getSettlement();
        SettlementSettings settings = new SettlementSettings(
                s.getPlatformFeeRateBps(), s.getPlatformFeeReceiver(), s.getEarlyRepayPenaltyDays());
        return new SettlementEngine(boundary, store, fund, ledger, health, transfer, settings, clock);
    }

    private static DegradationConfig degradation(AppProps props, AppProps.Degradation d) {
        return DegradationConfig.builder()
                .conservativeRatioBps(d.getConservativeRatioBps())
                .useStablecoinFaceValue(d.isUseStablecoinFaceValue())
                .enablePriceCache(d.isEnablePriceCache())
                .settlementAsset(props.getValuation().getSettlementAsset())
                .stablecoins(props.getValuation().getStablecoins())
                .build()
                .validate();
    }
}
