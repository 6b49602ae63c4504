package com.eyelevel.uploadqueue.common.apiclient.ingestion;

import com.eyelevel.uploadqueue.common.apiclient.ApiClient;
import com.eyelevel.uploadqueue.common.apiclient.authentication.Authentication;
import com.eyelevel.uploadqueue.common.apiclient.model.ApiRequest;
import com.eyelevel.uploadqueue.common.apiclient.model.ApiResponse;
import com.eyelevel.uploadqueue.common.json.JsonParser;
import com.eyelevel.uploadqueue.dto.ingestion.IngestionStatusReport;
import com.eyelevel.uploadqueue.dto.ingestion.ResourceAccepted;
import com.eyelevel.uploadqueue.dto.ingestion.ResourceCreateRequest;
import com.eyelevel.uploadqueue.dto.ingestion.ResourceStatusResponse;
import com.eyelevel.uploadqueue.dto.ingestion.TransferEvent;
import com.eyelevel.uploadqueue.exception.apiclient.ApiException;
import com.eyelevel.uploadqueue.model.UploadPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP client for the ingestion service's resource endpoints.
 */
@Slf4j
@Service("ingestionApiClient")
public class IngestionApiClient extends ApiClient implements IngestionClient {

    private static final int CHUNK_SIZE = 64 * 1024;
    private static final String FILE_PART = "file";

    private final JsonParser jsonParser;
    private final DataBufferFactory bufferFactory = DefaultDataBufferFactory.sharedInstance;

    @Value("${app.ingestion-client.endpoint.submit-reference}")
    private String submitReferenceEndpoint;

    @Value("${app.ingestion-client.endpoint.submit-file}")
    private String submitFileEndpoint;

    @Value("${app.ingestion-client.endpoint.fetch-status}")
    private String fetchStatusEndpoint;

    @Value("${app.ingestion-client.upload-timeout:PT10M}")
    private Duration uploadTimeout;

    public IngestionApiClient(
            @Qualifier("ingestionWebClient") final WebClient webClient,
            @Qualifier("ingestionAuthentication") final Authentication authentication,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.ingestion-client.request-timeout:PT30S}") final Duration requestTimeout
    ) {
        super(webClient, authentication, requestTimeout);
        this.jsonParser = jsonParser;
    }

    @Override
    public Flux<TransferEvent> submit(final UploadPayload payload) {
        return payload.isReference() ? submitReference(payload.sourceUrl()) : submitContent(payload);
    }

    @Override
    public Mono<IngestionStatusReport> fetchStatus(final String externalId) {
        final ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.GET)
                .path(fetchStatusEndpoint)
                .pathVariables(Map.of("resourceId", externalId))
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();

        return exchange(apiRequest)
                .map(response -> jsonParser.parseObject(response.getData(), ResourceStatusResponse.class))
                .map(ResourceStatusResponse::toReport)
                .doOnNext(report -> log.debug("Status for resource {}: {}", externalId, report));
    }

    private Flux<TransferEvent> submitReference(final String sourceUrl) {
        final ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(submitReferenceEndpoint)
                .body(new ResourceCreateRequest(sourceUrl))
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();

        return exchange(apiRequest)
                .map(this::toAcceptedEvent)
                .doOnNext(event -> log.info("Ingestion service accepted reference '{}' as resource {}.", sourceUrl,
                        event.externalId()))
                .flux();
    }

    /**
     * Streams local content as a multipart request and reports progress as chunks are handed to the
     * connection. Disposing the returned flux aborts the request.
     */
    private Flux<TransferEvent> submitContent(final UploadPayload payload) {
        return Flux.create(sink -> {
            final long totalBytes = contentLength(payload.content());
            final AtomicLong sentBytes = new AtomicLong();

            final Flux<DataBuffer> body = DataBufferUtils.read(payload.content(), bufferFactory, CHUNK_SIZE)
                    .doOnNext(buffer -> reportProgress(sink, sentBytes.addAndGet(buffer.readableByteCount()),
                            totalBytes));

            final MultipartBodyBuilder multipart = new MultipartBodyBuilder();
            multipart.asyncPart(FILE_PART, body, DataBuffer.class).filename(payload.fileName());

            final ApiRequest apiRequest = ApiRequest.builder()
                    .method(HttpMethod.POST)
                    .path(submitFileEndpoint)
                    .body(multipart.build())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .acceptMediaType(MediaType.APPLICATION_JSON)
                    .timeout(uploadTimeout)
                    .build();

            final Disposable exchange = exchange(apiRequest)
                    .map(this::toAcceptedEvent)
                    .subscribe(accepted -> {
                        log.info("Ingestion service accepted file '{}' as resource {}.", payload.fileName(),
                                accepted.externalId());
                        sink.next(accepted);
                        sink.complete();
                    }, sink::error);
            sink.onDispose(exchange);
        });
    }

    private void reportProgress(final FluxSink<TransferEvent> sink, final long sent, final long total) {
        if (total <= 0) {
            return;
        }
        final int percent = (int) Math.min(100, sent * 100 / total);
        sink.next(TransferEvent.progress(percent));
    }

    private long contentLength(final Resource content) {
        try {
            return content.contentLength();
        } catch (IOException e) {
            log.debug("Content length of {} is unknown, progress will not be reported.", content.getDescription());
            return -1;
        }
    }

    private TransferEvent toAcceptedEvent(final ApiResponse response) {
        final ResourceAccepted accepted = jsonParser.parseObject(response.getData(), ResourceAccepted.class);
        if (accepted == null || !StringUtils.hasText(accepted.id())) {
            throw new ApiException("Ingestion service accepted the upload but returned no resource id.",
                    HttpStatus.BAD_GATEWAY.value());
        }
        return TransferEvent.accepted(accepted.id());
    }
}
