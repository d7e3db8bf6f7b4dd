package com.lendledger.web3;

import com.lendledger.config.AppProps;
import com.lendledger.web3.exception.RetryableRpcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Web3j clients per network with bounded failover between RPC endpoints.
 *
 * A call is tried on at most {@code 1 + maxRetryCount} endpoints. Rate-limit and transport
 * errors penalise the endpoint for a short window and move on; anything else (a revert, a
 * decode error) fails at once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Web3ClientFactory {

    private static final Duration PENALTY = Duration.ofSeconds(20);
    private static final Duration BACKOFF = Duration.ofMillis(200);

    private final AppProps props;

    /** Endpoint with a penalty window (circuit half-open). */
    private static class Endpoint {
        final String url;
        final Web3j web3j;
        volatile Instant penaltyUntil = Instant.EPOCH;

        Endpoint(String url) {
            this.url = url;
            this.web3j = Web3j.build(new HttpService(url));
        }

        boolean isAvailable() {
            return Instant.now().isAfter(penaltyUntil);
        }

        void penalize(Duration d) {
            penaltyUntil = Instant.now().plus(d);
        }
    }

    private final Map<String, List<Endpoint>> endpointsByNet = new ConcurrentHashMap<>();
    private final Map<String, Integer> rrIndex = new ConcurrentHashMap<>();

    /**
     * Runs {@code fn} against the network's endpoints.
     *
     * @param fn must throw RetryableRpcException for logical rate-limit answers
     */
    public <T> T executeWithFailover(String network, Function<Web3j, T> fn) {
        List<Endpoint> ring = getOrInit(network);
        if (ring.isEmpty()) throw new IllegalStateException("No RPC URLs configured for network: " + network);

        final int total = ring.size();
        final int maxAttempts = Math.min(total, 1 + Math.max(0, props.require(network).getMaxRetryCount()));
        int start = rrIndex.compute(network, (k, v) -> v == null ? 0 : (v + 1) % total);

        RuntimeException last = null;
        int attempts = 0;
        for (int i = 0; i < total && attempts < maxAttempts; i++) {
            int idx = (start + i) % total;
            Endpoint ep = ring.get(idx);
            if (!ep.isAvailable()) continue;

            attempts++;
            try {
                T out = fn.apply(ep.web3j);
                rrIndex.put(network, idx);
                return out;
            } catch (RetryableRpcException ex) {
                last = ex;
                log.warn("[web3 failover] Retryable on {}: {}", ep.url, ex.getMessage());
                ep.penalize(PENALTY);
            } catch (RuntimeException ex) {
                String msg = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
                if (!isRetryableTransport(msg)) {
                    log.error("[web3 failover] Non-retryable on {}: {}", ep.url, ex.toString());
                    throw ex;
                }
                last = ex;
                log.warn("[web3 failover] Transport retryable on {}: {}", ep.url, ex.toString());
                ep.penalize(PENALTY);
            }

            if (attempts < maxAttempts) {
                try {
                    Thread.sleep(BACKOFF.toMillis() * attempts);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted during RPC failover for " + network, ie);
                }
            }
        }

        if (last != null) throw last;
        throw new IllegalStateException("No available RPC endpoint for network=" + network);
    }

    /**
     * Runs {@code fn} on the next available endpoint without any retry. Used for calls that must
     * not be repeated, such as sending a transaction.
     */
    public <T> T executeOnce(String network, Function<Web3j, T> fn) {
        List<Endpoint> ring = getOrInit(network);
        Endpoint ep = ring.stream().filter(Endpoint::isAvailable).findFirst()
                .orElseThrow(() -> new IllegalStateException("No available RPC endpoint for network=" + network));
        return fn.apply(ep.web3j);
    }

    static boolean isRetryableTransport(String msg) {
        if (msg.isEmpty()) return true;
        return msg.contains("429") ||
                msg.contains("rate limit") ||
                msg.contains("over rate") ||
                msg.contains("1015") ||
                msg.contains("timeout") ||
                msg.contains("timed out") ||
                msg.contains("connection") ||
                msg.contains("refused") ||
                msg.contains("unexpected end of stream");
    }

    static boolean isRateLimited(String msg) {
        if (msg == null) return false;
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("429") ||
                m.contains("rate limit") ||
                m.contains("over rate") ||
                m.contains("1015") ||
                m.contains("too many requests");
    }

    private List<Endpoint> getOrInit(String network) {
        return endpointsByNet.computeIfAbsent(network, net -> {
            var urls = props.require(net).getRpcUrls();
            if (urls == null || urls.isEmpty()) return List.of();
            List<Endpoint> list = new ArrayList<>(urls.size());
            for (String u : urls) list.add(new Endpoint(u));
            log.info("Initialized {} RPC endpoints for {}: {}", list.size(), net, urls);
            return list;
        });
    }
}
