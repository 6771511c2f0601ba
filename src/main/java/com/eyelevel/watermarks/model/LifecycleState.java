package com.eyelevel.watermarks.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Defines the admission and lifecycle states of a {@link JobRecord} in the job queue.
 * States only ever move forward: {@code QUEUED -> PROCESSING -> FINISHED -> DOWNLOADED},
 * or {@code PROCESSING -> ERROR}.
 */
public enum LifecycleState {
    /**
     * The job has been admitted and is waiting for the dispatch loop.
     */
    QUEUED,
    /**
     * The pipeline is running the job. At most one job is in this state.
     */
    PROCESSING,
    /**
     * The result is ready and the download window is open.
     */
    FINISHED,
    /**
     * The client fetched the result; the job is eligible for immediate reclamation.
     */
    DOWNLOADED,
    /**
     * The pipeline failed. Kept for the error retention period so clients can read the reason.
     */
    ERROR;

    /**
     * Checks whether a job in this state may move to {@code next}.
     *
     * @param next The requested state.
     * @return {@code true} if the transition is a legal forward step.
     */
    public boolean canTransitionTo(final LifecycleState next) {
        return switch (this) {
            case QUEUED -> next == PROCESSING;
            case PROCESSING -> next == FINISHED || next == ERROR;
            case FINISHED -> next == DOWNLOADED;
            case DOWNLOADED, ERROR -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LifecycleState fromWireName(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
