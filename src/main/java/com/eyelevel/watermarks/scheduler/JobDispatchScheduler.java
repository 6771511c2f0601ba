package com.eyelevel.watermarks.scheduler;

import com.eyelevel.watermarks.model.JobRecord;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.eyelevel.watermarks.service.pipeline.ChunkedWatermarkPipeline;
import com.eyelevel.watermarks.service.pipeline.ProgressCallback;
import com.eyelevel.watermarks.service.queue.JobQueueManager;
import com.eyelevel.watermarks.service.status.JobStatusTracker;
import com.eyelevel.watermarks.service.status.JobStatusUpdate;
import com.eyelevel.watermarks.service.storage.JobStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The single dispatch loop of the service. Each run starts at most one queued job and drives it
 * through the pipeline on the scheduler thread, so a new job can only start once the previous one
 * has finished or failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatchScheduler {

    private final JobQueueManager queueManager;
    private final ChunkedWatermarkPipeline pipeline;
    private final JobStatusTracker statusTracker;
    private final JobStorageService storageService;

    /**
     * Pops the next admissible job and processes it. Never throws; a failing job is recorded on both
     * the queue and the status tracker and the loop carries on with the next run.
     */
    @Scheduled(fixedDelayString = "${app.scheduler.dispatch-interval-ms:2000}",
            initialDelayString = "${app.scheduler.dispatch-initial-delay-ms:2000}")
    public void dispatchNextJob() {
        Optional<JobRecord> next;
        try {
            next = queueManager.popNext();
        } catch (Exception e) {
            log.error("Failed to pick the next job from the queue.", e);
            return;
        }
        if (next.isEmpty()) {
            log.trace("No job ready for dispatch.");
            return;
        }
        process(next.get());
    }

    void process(final JobRecord job) {
        final String jobId = job.getJobId();
        log.info("[JobId: {}] Starting pipeline (chunk size {}).", jobId, job.getChunkSize());
        try {
            Path result = pipeline.run(jobId, Path.of(job.getSourcePath()), job.getChunkSize(), progressFor(jobId));
            statusTracker.update(jobId, JobStatusUpdate.builder()
                                                       .stage(ProcessingStage.FINISHED)
                                                       .message("PDF processed successfully")
                                                       .resultPath(result.toString())
                                                       .build());
            if (queueManager.markFinished(jobId)) {
                log.info("[JobId: {}] Job finished. Download window is open.", jobId);
            } else {
                log.warn("[JobId: {}] Job was removed while processing. Discarding its result.", jobId);
                storageService.discardResult(jobId);
                statusTracker.delete(jobId);
            }
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[JobId: {}] Pipeline failed: {}", jobId, error, e);
            statusTracker.update(jobId, JobStatusUpdate.failure("Processing failed", error));
            queueManager.markError(jobId, error);
            storageService.discardResult(jobId);
        } finally {
            storageService.cleanupWorkingFiles(jobId);
        }
    }

    private ProgressCallback progressFor(final String jobId) {
        return (stage, progress) -> statusTracker.update(jobId, JobStatusUpdate.builder()
                                                                               .stage(stage)
                                                                               .progress(progress)
                                                                               .message(messageFor(stage))
                                                                               .build());
    }

    private static String messageFor(final ProcessingStage stage) {
        return switch (stage) {
            case UPLOADING -> "Uploading file";
            case SPLITTING -> "Splitting PDF into chunks";
            case TRANSFORMING -> "Applying watermarks";
            case MERGING -> "Merging watermarked chunks";
            case FINISHED -> "PDF processed successfully";
            case ERROR -> "Processing failed";
        };
    }
}
