package com.eyelevel.watermarks.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An immutable snapshot of a job's progress as exposed by the status tracker.
 */
@Value
@Builder(toBuilder = true)
public class JobStatus {
    String jobId;
    ProcessingStage stage;
    int progress;
    String message;
    String resultPath;
    String error;
    Instant createdAt;
    Instant updatedAt;
}
