package com.eyelevel.uploadqueue.service.inflight;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks one {@link CancellationToken} per upload between admission and its terminal transition.
 */
@Slf4j
@Component
public class InFlightOperationRegistry {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    /**
     * Opens a fresh token for an upload that is about to start transferring. An upload is only re-admitted
     * after its previous attempt recorded a terminal status, so a leftover token is superseded but not
     * cancelled: that attempt still has to report its outcome.
     */
    public CancellationToken open(String uploadId) {
        final CancellationToken token = new CancellationToken(uploadId);
        final CancellationToken previous = tokens.put(uploadId, token);
        if (previous != null) {
            log.debug("Upload {} re-admitted before its previous attempt finished reporting.", uploadId);
        }
        return token;
    }

    /**
     * Forgets {@code token} once its upload reached a terminal state. Does nothing if the upload has
     * since been given a different token.
     */
    public void close(CancellationToken token) {
        tokens.remove(token.getUploadId(), token);
    }

    /**
     * Cancels and forgets the upload's in-flight operation.
     *
     * @return {@code true} if there was an operation to cancel
     */
    public boolean cancel(String uploadId) {
        final CancellationToken token = tokens.remove(uploadId);
        if (token == null) {
            return false;
        }
        log.debug("Cancelling in-flight operation of upload {}.", uploadId);
        token.cancel();
        return true;
    }

    public boolean isInFlight(String uploadId) {
        return tokens.containsKey(uploadId);
    }

    public int size() {
        return tokens.size();
    }
}
