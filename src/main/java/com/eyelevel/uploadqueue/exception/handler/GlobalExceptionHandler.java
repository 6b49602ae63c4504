package com.eyelevel.uploadqueue.exception.handler;

import com.eyelevel.uploadqueue.dto.common.ApiResponse;
import com.eyelevel.uploadqueue.exception.InvalidUploadOperationException;
import com.eyelevel.uploadqueue.exception.UploadNotFoundException;
import com.eyelevel.uploadqueue.exception.apiclient.ApiException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the upload queue API.
 * It converts exceptions thrown from controllers into the standardized ApiResponse format
 * with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles payloads the queue refuses, such as a non-http(s) URL or an empty file. (400 Bad Request)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request body.", "The request body is missing or could not be parsed.");
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MultipartException.class})
    public ResponseEntity<ApiResponse<Object>> handleMultipart(Exception ex) {
        log.warn("Handling multipart exception: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid multipart request.", ex.getMessage());
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return build(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> String.format("'%s': %s",
                        // last node of the property path is the parameter name
                        violation.getPropertyPath().toString().substring(violation.getPropertyPath().toString().lastIndexOf('.') + 1),
                        violation.getMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return build(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    /**
     * Handles lookups, retries and cancels of an id the queue does not hold. (404 Not Found)
     */
    @ExceptionHandler(UploadNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(UploadNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed.", errorMessage);
    }

    /**
     * Handles retries of uploads that have not failed and cancels of finished uploads. (409 Conflict)
     */
    @ExceptionHandler(InvalidUploadOperationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(InvalidUploadOperationException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getMessage(), ex.getCurrentStatus());
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles ingestion service errors that escape to a request thread. (502 Bad Gateway)
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Object>> handleIngestionFailure(ApiException ex) {
        log.error("Ingestion Service Exception (status {}): {}", ex.getStatusCode(), ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), null);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
    }

    private static ResponseEntity<ApiResponse<Object>> build(HttpStatus status, String message, Object details) {
        return new ResponseEntity<>(ApiResponse.error(message, details, status.value()), status);
    }
}
