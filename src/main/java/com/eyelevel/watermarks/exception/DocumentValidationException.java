package com.eyelevel.watermarks.exception;

import java.io.Serial;

/**
 * Thrown at upload time when the file is malformed, encrypted, empty or otherwise unusable.
 * Not retryable.
 */
public class DocumentValidationException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public DocumentValidationException(String message) {
        super(message);
    }
}
