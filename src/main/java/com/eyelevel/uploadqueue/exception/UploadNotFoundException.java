package com.eyelevel.uploadqueue.exception;

import lombok.Getter;

import java.io.Serial;

@Getter
public class UploadNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1280412979331547307L;

    private final String uploadId;

    public UploadNotFoundException(String uploadId) {
        super("Upload " + uploadId + " not found.");
        this.uploadId = uploadId;
    }
}
