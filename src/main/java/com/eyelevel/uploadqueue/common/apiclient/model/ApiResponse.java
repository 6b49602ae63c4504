package com.eyelevel.uploadqueue.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Successful (2xx) response from the ingestion service, body kept as raw bytes for the JSON parser.
 */
@Builder
@Getter
public class ApiResponse {

    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
