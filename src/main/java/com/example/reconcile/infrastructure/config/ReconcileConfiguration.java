package com.example.reconcile.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Infrastructure beans shared by the application services.
 */
@Configuration
public class ReconcileConfiguration {

    /**
     * Clock used for "today" in date bounds and candidate windows.
     *
     * @return system clock in the default zone
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * HTTP client for the LLM endpoint with bounded connect and read timeouts.
     *
     * @param properties LLM settings
     * @return configured client
     */
    @Bean
    public RestClient llmRestClient(LlmProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
