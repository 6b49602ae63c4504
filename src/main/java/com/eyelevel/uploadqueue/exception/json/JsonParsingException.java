package com.eyelevel.uploadqueue.exception.json;

import com.eyelevel.uploadqueue.exception.apiclient.ApiException;
import org.springframework.http.HttpStatus;

import java.io.Serial;

/**
 * The ingestion service answered with a body that cannot be read. Reported as a bad gateway, since the
 * request itself may well have succeeded on the remote side.
 */
public class JsonParsingException extends ApiException {
    @Serial
    private static final long serialVersionUID = 5526719311984466173L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, HttpStatus.BAD_GATEWAY.value(), cause);
    }
}
