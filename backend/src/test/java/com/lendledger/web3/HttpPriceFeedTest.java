package com.lendledger.web3;

import com.lendledger.support.MutableClock;
import com.lendledger.valuation.PriceQuote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.time.Instant;

import static com.lendledger.support.TestAddresses.WETH;
import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpPriceFeedTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final RestTemplate rest = new RestTemplate();
    private final HttpPriceFeed feed =
            new HttpPriceFeed(rest, "http://prices.local/v1/{asset}", "price", 8, new MutableClock(NOW));
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        server = MockRestServiceServer.bindTo(rest).build();
    }

    @Test
    @DisplayName("scales a decimal price and stamps it with the local clock")
    void decodesRootPrice() {
        PriceQuote q = feed.decode("{\"price\":\"2000.5\"}");

        assertThat(q.getPrice()).isEqualTo(new BigInteger("200050000000"));
        assertThat(q.getDecimals()).isEqualTo(8);
        assertThat(q.getTimestamp()).isEqualTo(NOW.getEpochSecond());
        assertThat(q.isSourceHealthy()).isTrue();
    }

    @Test
    @DisplayName("reads the price, timestamp and health from a data envelope")
    void decodesEnvelope() {
        PriceQuote q = feed.decode("{\"data\":{\"price\":1.25,\"timestamp\":1700000000,\"healthy\":false}}");

        assertThat(q.getPrice()).isEqualTo(BigInteger.valueOf(125_000_000L));
        assertThat(q.getTimestamp()).isEqualTo(1_700_000_000L);
        assertThat(q.isSourceHealthy()).isFalse();
    }

    @Test
    @DisplayName("an answer without the price field is a failed call")
    void missingField() {
        assertThatIllegalStateException().isThrownBy(() -> feed.decode("{\"usd\":1}"))
                .withMessageContaining("'price'");
        assertThatIllegalStateException().isThrownBy(() -> feed.decode("not json"));
    }

    @Test
    @DisplayName("fetches the asset URL and turns HTTP errors into failed calls")
    void fetches() {
        server.expect(requestTo("http://prices.local/v1/" + WETH))
                .andRespond(withSuccess("{\"price\":\"1999\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://prices.local/v1/" + WETH))
                .andRespond(withServerError());

        assertThat(feed.latestQuote(WETH).getPrice()).isEqualTo(new BigInteger("199900000000"));
        assertThatIllegalStateException().isThrownBy(() -> feed.latestQuote(WETH))
                .withMessageContaining("HTTP error");
        server.verify();
    }
}
