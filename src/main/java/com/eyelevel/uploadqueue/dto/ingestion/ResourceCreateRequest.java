package com.eyelevel.uploadqueue.dto.ingestion;

/**
 * Request body for submitting a remote reference to the ingestion service.
 *
 * @param url The locator the ingestion service downloads the content from.
 */
public record ResourceCreateRequest(String url) {
}
