package com.eyelevel.uploadqueue.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for every response of the upload queue API, successful or not.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data. For errors, optional details about the failure.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> ok(final String displayMessage, final T response, final int statusCode) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .response(response)
                .showMessage(true)
                .statusCode(statusCode)
                .build();
    }

    public static ApiResponse<Object> error(final String displayMessage, final int statusCode) {
        return error(displayMessage, null, statusCode);
    }

    public static ApiResponse<Object> error(final String displayMessage, final Object details, final int statusCode) {
        return ApiResponse.builder()
                .displayMessage(displayMessage)
                .response(details)
                .showMessage(true)
                .statusCode(statusCode)
                .build();
    }
}
