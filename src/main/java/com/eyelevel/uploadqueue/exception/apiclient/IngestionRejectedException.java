package com.eyelevel.uploadqueue.exception.apiclient;

import java.io.Serial;

/**
 * The ingestion service answered with a 4xx status: the submission itself was refused
 * (invalid URL, unsupported content, authentication failure and the like).
 */
public class IngestionRejectedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6155327270917406013L;

    public IngestionRejectedException(String message, int statusCode) {
        super(message, statusCode);
    }
}
