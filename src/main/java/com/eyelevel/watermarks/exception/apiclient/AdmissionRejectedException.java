package com.eyelevel.watermarks.exception.apiclient;

import com.eyelevel.watermarks.service.queue.AdmissionRejectionReason;
import lombok.Getter;

import java.io.Serial;

/**
 * Exception indicating that the server cannot take the job right now (HTTP 503). Recoverable:
 * it carries the reason code and a retry-after estimate.
 */
@Getter
public class AdmissionRejectedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5386201857120433175L;

    private final AdmissionRejectionReason reason;
    private final long retryAfterSeconds;

    public AdmissionRejectedException(String message, AdmissionRejectionReason reason, long retryAfterSeconds) {
        super(message, 503);
        this.reason = reason;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
