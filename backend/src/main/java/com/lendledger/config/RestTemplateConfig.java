package com.lendledger.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.List;

@Configuration
public class RestTemplateConfig {

    /** Price API calls have a short budget; a slow answer is a failed call. */
    @Bean
    @Qualifier("priceApiRestTemplate")
    public RestTemplate priceApiRestTemplate() {
        return buildRestTemplate(3, 5, "lend-ledger/price-feed");
    }

    private RestTemplate buildRestTemplate(int connectTimeoutSec, int readTimeoutSec, String userAgent) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setResponseTimeout(Timeout.ofSeconds(readTimeoutSec))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);
        f.setConnectTimeout(connectTimeoutSec * 1000);

        RestTemplate rt = new RestTemplate(f);
        rt.getInterceptors().add((request, body, execution) -> {
            HttpHeaders h = request.getHeaders();
            h.set(HttpHeaders.USER_AGENT, userAgent);
            h.setAccept(List.of(MediaType.APPLICATION_JSON));
            return execution.execute(request, body);
        });
        return rt;
    }
}
