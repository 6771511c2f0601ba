package com.eyelevel.watermarks.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Fine-grained pipeline stages reported through the status tracker. Independent of the queue's
 * {@link LifecycleState}; used purely for progress reporting.
 */
@Getter
@RequiredArgsConstructor
public enum ProcessingStage {
    UPLOADING(10, true),
    SPLITTING(30, true),
    TRANSFORMING(50, true),
    MERGING(80, true),
    FINISHED(100, false),
    ERROR(0, false);

    /**
     * Progress assigned automatically when a job enters this stage.
     */
    private final int automaticProgress;

    /**
     * Whether a job in this stage is still consuming resources.
     */
    private final boolean active;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProcessingStage fromWireName(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
