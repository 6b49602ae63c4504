package com.eyelevel.uploadqueue.common.apiclient;

import com.eyelevel.uploadqueue.common.apiclient.authentication.Authentication;
import com.eyelevel.uploadqueue.common.apiclient.model.ApiRequest;
import com.eyelevel.uploadqueue.common.apiclient.model.ApiResponse;
import com.eyelevel.uploadqueue.exception.apiclient.ApiException;
import com.eyelevel.uploadqueue.exception.apiclient.IngestionRejectedException;
import com.eyelevel.uploadqueue.exception.apiclient.IngestionUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients. Builds {@link WebClient} exchanges from {@link ApiRequest}s,
 * applies authentication and maps every failure onto the {@link ApiException} hierarchy.
 * <p>
 * Calls are non-blocking: each exchange is returned as a cold {@link Mono}, so nothing is sent until the
 * caller subscribes, and disposing the subscription aborts the request.
 */
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    private final Duration defaultTimeout;

    protected ApiClient(WebClient webClient, Authentication authentication, Duration defaultTimeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.defaultTimeout = defaultTimeout != null ? defaultTimeout : DEFAULT_TIMEOUT;
    }

    /**
     * Prepares the exchange described by {@code apiRequest}.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return A cold {@link Mono} emitting the response of a 2xx exchange, or an {@link ApiException}.
     */
    protected Mono<ApiResponse> exchange(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        final Duration timeout = Optional.ofNullable(apiRequest.getTimeout()).orElse(defaultTimeout);

        return Mono.defer(() -> {
                    log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());
                    WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
                    configureHeaders(apiRequest, requestBodySpec);
                    configureBody(apiRequest, requestBodySpec);
                    return requestBodySpec.exchangeToMono(this::handleResponse);
                })
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof ApiException), this::mapException)
                .doOnError(error -> log.warn("API call {} {} failed: {}", apiRequest.getMethod(),
                        apiRequest.getPath(), error.getMessage()));
    }

    /**
     * Maps transport-level exceptions onto the {@link ApiException} hierarchy.
     */
    private RuntimeException mapException(Throwable error) {
        log.debug("Mapping exception: {}", error.getMessage(), error);
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException
                || error instanceof UnknownHostException) {
            return new IngestionUnavailableException("Failed to connect to ingestion service: " + error.getMessage(),
                    HttpStatus.SERVICE_UNAVAILABLE.value(), error);

        } else if (error instanceof TimeoutException) {
            return new IngestionUnavailableException("Request timed out: " + error.getMessage(),
                    HttpStatus.GATEWAY_TIMEOUT.value(), error);

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);

        } else {
            return new ApiException("Internal API client error: " + error.getMessage(),
                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);
        }
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    @SuppressWarnings("unchecked")
    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        if (apiRequest.getBody() instanceof MultiValueMap<?, ?> parts
                && MediaType.MULTIPART_FORM_DATA.isCompatibleWith(contentType)) {
            requestBodySpec.body(BodyInserters.fromMultipartData((MultiValueMap<String, ?>) parts));
        } else {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();

        if (response.statusCode().is2xxSuccessful()) {
            log.debug("Response was successful, statusCode {}", statusCode);
            return response.bodyToMono(byte[].class)
                    .defaultIfEmpty(new byte[0])
                    .map(data -> ApiResponse.builder()
                            .data(data)
                            .contentType(response.headers().contentType().orElse(null))
                            .headers(response.headers().asHttpHeaders())
                            .statusCode(statusCode)
                            .timestamp(Instant.now())
                            .build());
        }

        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * 4xx answers mean the ingestion service refused the request; everything else is treated as the
     * service being unavailable.
     */
    private ApiException createException(String body, int statusCode) {
        String message = body == null || body.isBlank()
                ? "Ingestion service responded with HTTP " + statusCode
                : body;
        ApiException exception = statusCode >= 400 && statusCode < 500
                ? new IngestionRejectedException(message, statusCode)
                : new IngestionUnavailableException(message, statusCode);
        log.warn("Api request failing with status {}: {}", statusCode, exception.getMessage());
        return exception;
    }
}
