package com.eyelevel.watermarks.service.pipeline;

import com.eyelevel.watermarks.model.ProcessingStage;

/**
 * Receives stage changes and progress from a pipeline run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param stage    The stage the job is in.
     * @param progress Explicit progress in percent, or {@code null} to use the stage's automatic value.
     */
    void report(ProcessingStage stage, Integer progress);

    default void report(final ProcessingStage stage) {
        report(stage, null);
    }

    static ProgressCallback noop() {
        return (stage, progress) -> {
        };
    }
}
