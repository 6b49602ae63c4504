package com.eyelevel.uploadqueue.model;

import org.springframework.core.io.Resource;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * What gets handed to the ingestion service: either local content or a remote source locator.
 * Exactly one of {@code content} and {@code sourceUrl} is set.
 *
 * @param fileName  display name of the local content, {@code null} for references
 * @param content   local content to stream to the ingestion service, {@code null} for references
 * @param sourceUrl remote locator the ingestion service fetches itself, {@code null} for local content
 */
public record UploadPayload(String fileName, Resource content, String sourceUrl) {

    public UploadPayload {
        if ((content == null) == (sourceUrl == null)) {
            throw new IllegalArgumentException("Exactly one of local content or source URL must be provided.");
        }
    }

    /**
     * Wraps local content. The resource must be readable for as long as the upload may be retried.
     */
    public static UploadPayload ofContent(final String fileName, final Resource content) {
        Objects.requireNonNull(content, "content must not be null");
        if (!content.exists()) {
            throw new IllegalArgumentException("Upload content does not exist: " + content.getDescription());
        }
        final String name = StringUtils.hasText(fileName) ? fileName : content.getFilename();
        return new UploadPayload(StringUtils.hasText(name) ? name : "upload", content, null);
    }

    /**
     * Wraps a remote locator. Only absolute http(s) URLs are accepted.
     */
    public static UploadPayload ofReference(final String sourceUrl) {
        if (!StringUtils.hasText(sourceUrl)) {
            throw new IllegalArgumentException("Source URL must not be blank.");
        }
        final String trimmed = sourceUrl.trim();
        final URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Source URL is malformed: " + trimmed, e);
        }
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!("http".equals(scheme) || "https".equals(scheme)) || !StringUtils.hasText(uri.getHost())) {
            throw new IllegalArgumentException("Source URL must be an absolute http(s) URL: " + trimmed);
        }
        return new UploadPayload(null, null, trimmed);
    }

    public boolean isReference() {
        return sourceUrl != null;
    }

    public PayloadKind kind() {
        return isReference() ? PayloadKind.REFERENCE : PayloadKind.FILE;
    }

    public String displayName() {
        return isReference() ? sourceUrl : fileName;
    }
}
