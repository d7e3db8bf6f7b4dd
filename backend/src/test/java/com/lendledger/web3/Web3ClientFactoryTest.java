package com.lendledger.web3;

import com.lendledger.config.AppProps;
import com.lendledger.web3.exception.RetryableRpcException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class Web3ClientFactoryTest {

    private Web3ClientFactory factory(int maxRetryCount) {
        AppProps props = new AppProps();
        AppProps.Network net = new AppProps.Network();
        net.setRpcUrls(List.of("http://rpc-a.local", "http://rpc-b.local", "http://rpc-c.local"));
        net.setMaxRetryCount(maxRetryCount);
        props.getNetwork().put("test", net);
        return new Web3ClientFactory(props);
    }

    @Test
    @DisplayName("transport errors are retried on at most 1 + maxRetryCount endpoints")
    void boundedRetries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> factory(1).executeWithFailover("test", w -> {
            calls.incrementAndGet();
            throw new IllegalStateException("Connection refused");
        })).hasMessage("Connection refused");

        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("a rate-limited endpoint is skipped and the next one answers")
    void failsOver() {
        AtomicInteger calls = new AtomicInteger();

        String out = factory(2).executeWithFailover("test", w -> {
            if (calls.incrementAndGet() == 1) throw new RetryableRpcException("429 Too Many Requests");
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("non-transport errors fail at once and sends are never repeated")
    void noRetry() {
        Web3ClientFactory f = factory(2);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> f.executeWithFailover("test", w -> {
            calls.incrementAndGet();
            throw new IllegalStateException("execution reverted");
        })).hasMessage("execution reverted");
        assertThatThrownBy(() -> f.executeOnce("test", w -> {
            calls.incrementAndGet();
            throw new IllegalStateException("timeout");
        })).hasMessage("timeout");

        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("classifies rate-limit and transport messages")
    void classification() {
        assertThat(Web3ClientFactory.isRateLimited("HTTP 429")).isTrue();
        assertThat(Web3ClientFactory.isRateLimited("execution reverted")).isFalse();
        assertThat(Web3ClientFactory.isRetryableTransport("read timed out")).isTrue();
        assertThat(Web3ClientFactory.isRetryableTransport("invalid opcode")).isFalse();
        assertThatIllegalArgumentException().isThrownBy(() -> factory(1).executeOnce("mainnet", w -> "x"));
    }
}
