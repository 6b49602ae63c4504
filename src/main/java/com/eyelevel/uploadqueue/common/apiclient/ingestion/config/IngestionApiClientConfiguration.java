package com.eyelevel.uploadqueue.common.apiclient.ingestion.config;

import com.eyelevel.uploadqueue.common.apiclient.authentication.Authentication;
import com.eyelevel.uploadqueue.common.apiclient.authentication.impl.APIKeyAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient} and {@link Authentication} used to reach the ingestion service.
 */
@Slf4j
@Configuration
public class IngestionApiClientConfiguration {

    @Value("${app.ingestion-client.baseurl}")
    private String baseUrl;

    @Value("${app.ingestion-client.auth-key-name:}")
    private String headerName;

    @Value("${app.ingestion-client.auth-key-value:}")
    private String headerValue;

    @Bean("ingestionWebClient")
    public WebClient ingestionWebClient(WebClient.Builder webClientBuilder) {
        log.info("Initializing ingestion service WebClient with base URL: {}", baseUrl);
        return webClientBuilder
                .baseUrl(baseUrl)
                .build();
    }

    @Bean("ingestionAuthentication")
    public Authentication ingestionAuthentication() {
        if (headerValue == null || headerValue.isBlank()) {
            log.warn("Ingestion service API key is not configured. Requests are sent without authentication.");
        } else {
            log.info("Initializing ingestion service authentication with header name: '{}'", headerName);
        }
        return new APIKeyAuthentication(headerName, headerValue);
    }
}
