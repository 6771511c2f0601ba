package com.eyelevel.watermarks.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for exceptions that map onto a specific HTTP status.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
