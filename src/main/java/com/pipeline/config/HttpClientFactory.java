package com.pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates the shared HTTP client used by every pipeline step.
 * <p>
 * Retries and timeouts are not configured here: they differ per step and are applied by the
 * executor for each call.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Largest response body buffered in memory.
     */
    static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    /**
     * @return the {@link WebClient} shared by all pipeline steps
     */
    @Bean
    public WebClient webClient() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
        return WebClient.builder()
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, "api-pipeline/0.0.1")
                .build();
    }
}
