package com.eyelevel.watermarks.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the download window of a finished job has passed and its result was
 * reclaimed (HTTP 410). The client must resubmit the document.
 */
public class DownloadExpiredException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6920175408262035416L;

    public DownloadExpiredException(String jobId) {
        super("The download window for job " + jobId + " has expired. Please upload the document again.", 410);
    }
}
