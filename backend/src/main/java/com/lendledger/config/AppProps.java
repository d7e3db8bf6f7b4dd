package com.lendledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Valuation valuation = new Valuation();
    private Risk risk = new Risk();
    private Settlement settlement = new Settlement();
    private Map<String, Network> network = new LinkedHashMap<>();
    /** asset address -> feed definition */
    private Map<String, Feed> feeds = new LinkedHashMap<>();
    private Transfer transfer = new Transfer();
    private Access access = new Access();
    private Health health = new Health();

    public Network require(String networkName) {
        Network n = (network != null) ? network.get(networkName) : null;
        if (n == null) throw new IllegalArgumentException("Unknown network: " + networkName);
        return n;
    }

    @Data
    public static class Network {
        private List<String> rpcUrls;
        private String chainId;
        /** extra endpoint attempts after the first failure */
        private int maxRetryCount = 1;
    }

    @Data
    public static class Valuation {
        /** asset the ledger settles in; valued at face when its feed is down */
        private String settlementAsset;
        private List<String> stablecoins = new ArrayList<>();
        private Degradation collateral = new Degradation(5_000);
        private Degradation debt = new Degradation(15_000);
        private Validation validation = new Validation();
    }

    @Data
    public static class Degradation {
        private int conservativeRatioBps;
        private boolean useStablecoinFaceValue = true;
        private boolean enablePriceCache = true;

        public Degradation() {
            this(5_000);
        }

        public Degradation(int conservativeRatioBps) {
            this.conservativeRatioBps = conservativeRatioBps;
        }
    }

    @Data
    public static class Validation {
        private long minMultiplierBps = 5_000;
        private long maxMultiplierBps = 15_000;
        /** normalised to 18 decimals */
        private BigInteger maxReasonablePrice = BigInteger.TEN.pow(30);
        private long maxPriceAgeSeconds = 3_600;
    }

    @Data
    public static class Risk {
        private long minHealthFactorBps = 10_500;
        private long borrowHealthFactorBps = 12_000;
    }

    @Data
    public static class Settlement {
        private int platformFeeRateBps = 100;
        private String platformFeeReceiver;
        private int earlyRepayPenaltyDays = 2;
    }

    @Data
    public static class Feed {
        /** "chainlink" or "http" */
        private String type = "chainlink";
        private String network;
        /** aggregator contract, chainlink only */
        private String aggregator;
        /** price endpoint, http only; {asset} is replaced with the asset address */
        private String url;
        /** JSON field holding the price, http only */
        private String priceField = "price";
        private int decimals = 8;
    }

    @Data
    public static class Transfer {
        /** "dry-run" or "erc20" */
        private String mode = "dry-run";
        private String network;
        private String privateKey;
        private BigInteger gasPrice = BigInteger.valueOf(1_000_000_000L);
        private BigInteger gasLimit = BigInteger.valueOf(120_000L);
        private long receiptTimeoutSeconds = 60;
    }

    @Data
    public static class Access {
        /** when false every caller may run every action */
        private boolean enforce = true;
        /** action id -> callers allowed to run it */
        private Map<String, List<String>> claims = new LinkedHashMap<>();
    }

    @Data
    public static class Health {
        private String cron = "0 */5 * * * ?";
        private List<String> assets = new ArrayList<>();
    }
}
