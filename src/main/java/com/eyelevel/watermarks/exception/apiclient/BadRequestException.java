package com.eyelevel.watermarks.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the request was malformed or invalid (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2164829071651723351L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
