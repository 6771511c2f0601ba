package com.eyelevel.watermarks.dto.status;

import com.eyelevel.watermarks.model.LifecycleState;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * The status of one job as seen by a polling client: pipeline progress from the status tracker
 * combined with the job's place in the queue.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(String jobId,
                                ProcessingStage status,
                                int progress,
                                String message,
                                String resultPath,
                                String error,
                                LifecycleState lifecycleState,
                                int queuePosition,
                                long estimatedWaitSeconds,
                                Instant downloadWindowExpires) {
}
