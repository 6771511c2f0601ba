package com.eyelevel.watermarks.exception;

import java.io.Serial;

/**
 * Thrown when the split, watermark or merge phase of a job fails. Terminal for that job.
 */
public class PipelineException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -2736519025738110487L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
