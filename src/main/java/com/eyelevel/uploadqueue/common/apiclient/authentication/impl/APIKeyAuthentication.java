package com.eyelevel.uploadqueue.common.apiclient.authentication.impl;

import com.eyelevel.uploadqueue.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Sends a static API key in a configurable header. A blank key means the ingestion service is
 * reachable without authentication, in which case nothing is added.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (!StringUtils.hasText(headerName) || !StringUtils.hasText(apiKey)) {
            log.trace("No API key configured, sending request without authentication header.");
            return;
        }
        log.debug("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }
}
