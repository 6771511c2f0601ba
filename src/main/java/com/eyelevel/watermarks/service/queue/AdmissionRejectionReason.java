package com.eyelevel.watermarks.service.queue;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable reason returned to a client whose upload could not be admitted.
 */
public enum AdmissionRejectionReason {
    DISK_SPACE("disk_space"),
    MEMORY("memory");

    private final String code;

    AdmissionRejectionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
