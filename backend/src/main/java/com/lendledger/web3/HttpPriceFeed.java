package com.lendledger.web3;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendledger.valuation.PriceFeed;
import com.lendledger.valuation.PriceQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;

/**
 * Price from a JSON HTTP endpoint. Accepts {"price": ...} at the root or under "data";
 * a decimal price is scaled to {@code decimals}. Optional "timestamp" (epoch seconds) and
 * "healthy" fields are honoured, otherwise the answer is taken as fresh and healthy.
 */
@Slf4j
public class HttpPriceFeed implements PriceFeed {

    private final RestTemplate rest;
    private final String urlTemplate;
    private final String priceField;
    private final int decimals;
    private final Clock clock;

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public HttpPriceFeed(RestTemplate rest, String urlTemplate, String priceField, int decimals, Clock clock) {
        this.rest = rest;
        this.urlTemplate = urlTemplate;
        this.priceField = priceField;
        this.decimals = decimals;
        this.clock = clock;
    }

    @Override
    public PriceQuote latestQuote(String asset) {
        String url = urlTemplate.replace("{asset}", asset);
        String body;
        try {
            ResponseEntity<String> resp = rest.getForEntity(url, String.class);
            if (!resp.getStatusCode().is2xxSuccessful() || resp.getBody() == null) {
                throw new IllegalStateException("price API HTTP " + resp.getStatusCode());
            }
            body = resp.getBody();
        } catch (HttpStatusCodeException httpEx) {
            throw new IllegalStateException("price API HTTP error " + httpEx.getStatusCode(), httpEx);
        }
        return decode(body);
    }

    @Override
    public String name() {
        return "http:" + urlTemplate;
    }

    PriceQuote decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException("price API decode error: " + e.getMessage(), e);
        }
        JsonNode node = root != null && root.has("data") ? root.get("data") : root;
        if (node == null || !node.hasNonNull(priceField)) {
            throw new IllegalStateException("price API answer has no '" + priceField + "'");
        }
        BigInteger price = new BigDecimal(node.get(priceField).asText())
                .movePointRight(decimals)
                .toBigInteger();
        long ts = node.hasNonNull("timestamp") ? node.get("timestamp").asLong() : clock.instant().getEpochSecond();
        boolean healthy = !node.has("healthy") || node.get("healthy").asBoolean(true);
        log.debug("[http-feed] price={} decimals={} ts={}", price, decimals, ts);
        return PriceQuote.builder().price(price).decimals(decimals).timestamp(ts).sourceHealthy(healthy).build();
    }
}
