package com.eyelevel.watermarks.service.queue;

/**
 * Outcome of an admission check. A rejection carries a reason code and a retry-after hint in seconds.
 */
public record AdmissionDecision(boolean admitted, AdmissionRejectionReason reason, String message,
                                long retryAfterSeconds) {

    public static AdmissionDecision admit() {
        return new AdmissionDecision(true, null, "OK", 0);
    }

    public static AdmissionDecision reject(final AdmissionRejectionReason reason, final String message,
                                           final long retryAfterSeconds) {
        return new AdmissionDecision(false, reason, message, retryAfterSeconds);
    }
}
