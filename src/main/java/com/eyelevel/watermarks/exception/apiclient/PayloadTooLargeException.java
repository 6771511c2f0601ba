package com.eyelevel.watermarks.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that an upload exceeds what the server can process right now (HTTP 413).
 */
public class PayloadTooLargeException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7713962510244580193L;

    public PayloadTooLargeException(String message) {
        super(message, 413);
    }
}
