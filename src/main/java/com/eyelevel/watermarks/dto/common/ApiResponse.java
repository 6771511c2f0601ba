package com.eyelevel.watermarks.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses,
 * making it easy for clients (like the UI) to handle them.
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
     * The response data.
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

    /**
     * Technical detail for failed requests.
     */
    private final String error;

    public static <T> ApiResponse<T> error(final String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static <T> ApiResponse<T> error(final String displayMessage, final String error) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).error(error).showMessage(true).build();
    }

    public static <T> ApiResponse<T> errorWithDetails(final String displayMessage, final T details) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).response(details).showMessage(true).build();
    }
}
