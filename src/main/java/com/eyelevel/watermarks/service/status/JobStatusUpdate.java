package com.eyelevel.watermarks.service.status;

import com.eyelevel.watermarks.model.ProcessingStage;
import lombok.Builder;
import lombok.Value;

/**
 * A partial update applied to a job's status. Every field is optional; {@code null} leaves the
 * current value untouched.
 */
@Value
@Builder
public class JobStatusUpdate {
    ProcessingStage stage;
    Integer progress;
    String message;
    String resultPath;
    String error;

    public static JobStatusUpdate stage(final ProcessingStage stage) {
        return JobStatusUpdate.builder().stage(stage).build();
    }

    public static JobStatusUpdate stage(final ProcessingStage stage, final int progress) {
        return JobStatusUpdate.builder().stage(stage).progress(progress).build();
    }

    public static JobStatusUpdate failure(final String message, final String error) {
        return JobStatusUpdate.builder().message(message).error(error).build();
    }
}
