package com.eyelevel.uploadqueue.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to the ingestion service.
 *
 * <p>Encapsulates method, path, variables, headers and body. The body is either a value serialized with
 * the request's content type or, for multipart requests, a {@code MultiValueMap} of parts.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL, may contain {@code {variable}} placeholders.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Mutable so that authentication can add its header before the request is sent.
     */
    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;

    /**
     * Overrides the client's default response timeout, e.g. for large uploads.
     */
    @Nullable
    private final Duration timeout;
}
