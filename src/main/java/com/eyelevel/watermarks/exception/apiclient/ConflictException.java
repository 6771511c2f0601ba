package com.eyelevel.watermarks.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the resource is not in a state that allows the request (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1487123909346671250L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
