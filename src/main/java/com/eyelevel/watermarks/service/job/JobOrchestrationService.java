package com.eyelevel.watermarks.service.job;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.dto.admin.CleanupResponse;
import com.eyelevel.watermarks.dto.admin.JobListingResponse;
import com.eyelevel.watermarks.dto.health.HealthResponse;
import com.eyelevel.watermarks.dto.status.JobStatusResponse;
import com.eyelevel.watermarks.dto.upload.UploadResponse;
import com.eyelevel.watermarks.exception.DocumentValidationException;
import com.eyelevel.watermarks.exception.apiclient.AdmissionRejectedException;
import com.eyelevel.watermarks.exception.apiclient.BadRequestException;
import com.eyelevel.watermarks.exception.apiclient.ConflictException;
import com.eyelevel.watermarks.exception.apiclient.DownloadExpiredException;
import com.eyelevel.watermarks.exception.apiclient.NotFoundException;
import com.eyelevel.watermarks.exception.apiclient.PayloadTooLargeException;
import com.eyelevel.watermarks.model.JobRecord;
import com.eyelevel.watermarks.model.JobStatus;
import com.eyelevel.watermarks.model.LifecycleState;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.eyelevel.watermarks.service.queue.AdmissionDecision;
import com.eyelevel.watermarks.service.queue.JobQueueManager;
import com.eyelevel.watermarks.service.status.JobStatusTracker;
import com.eyelevel.watermarks.service.status.JobStatusUpdate;
import com.eyelevel.watermarks.service.storage.JobStorageService;
import com.eyelevel.watermarks.service.validation.UploadValidationService;
import com.eyelevel.watermarks.service.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for the API layer. Turns an upload into a queued job and answers status, download
 * and cleanup requests by combining the job queue with the status tracker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobOrchestrationService {

    private final UploadValidationService validationService;
    private final JobQueueManager queueManager;
    private final JobStatusTracker statusTracker;
    private final JobStorageService storageService;
    private final JobQueueConfig queueConfig;

    /**
     * Validates an upload, stores it and appends it to the queue.
     *
     * @param ownerId          The submitting session.
     * @param originalFilename The client's file name, used for the type check.
     * @param declaredSize     The upload size in bytes.
     * @param content          The upload body.
     * @param chunkSize        Requested pages per chunk.
     * @return The new job id with its queue position and estimated wait.
     * @throws BadRequestException          for a wrong file type or chunk size.
     * @throws PayloadTooLargeException     if the file exceeds the current size limit.
     * @throws DocumentValidationException  if the file is not a usable PDF.
     * @throws AdmissionRejectedException   if the host lacks disk or memory right now.
     */
    public UploadResponse submit(final String ownerId, final String originalFilename, final long declaredSize,
                                 final InputStream content, final int chunkSize) {
        if (!validationService.isAllowedFile(originalFilename)) {
            throw new BadRequestException("Invalid file type. Only PDF files are allowed.");
        }
        if (chunkSize <= 0) {
            throw new BadRequestException("Chunk size must be greater than 0");
        }
        ValidationResult sizeCheck = validationService.validateFileSizeOnUpload(declaredSize);
        if (!sizeCheck.valid()) {
            throw new PayloadTooLargeException(sizeCheck.message());
        }

        String jobId = UUID.randomUUID().toString();
        statusTracker.create(jobId, "Uploading file");
        log.info("[JobId: {}] Receiving upload '{}' ({} bytes) from owner {}.", jobId, originalFilename, declaredSize,
                 ownerId);

        Path uploadPath = storeUpload(jobId, content);
        ValidationResult pdfCheck = validationService.validatePdfStructure(uploadPath);
        if (!pdfCheck.valid()) {
            discard(jobId);
            log.warn("[JobId: {}] Upload rejected: {}", jobId, pdfCheck.message());
            throw new DocumentValidationException(pdfCheck.message());
        }

        AdmissionDecision decision = queueManager.canAdmit(ownerId, declaredSize);
        if (!decision.admitted()) {
            discard(jobId);
            throw new AdmissionRejectedException(decision.message(), decision.reason(), decision.retryAfterSeconds());
        }

        queueManager.add(jobId, ownerId, uploadPath.toString(), declaredSize, chunkSize);
        int position = queueManager.queuePosition(jobId);
        long estimatedWait = queueManager.estimateWait(jobId);
        statusTracker.update(jobId, JobStatusUpdate.builder()
                                                   .message(String.format("PDF validated (%s pages). Queued at position %d",
                                                                          pdfCheck.metadata().get("num_pages"),
                                                                          position))
                                                   .build());
        return new UploadResponse(jobId, "File uploaded successfully. Waiting in queue.", position, estimatedWait);
    }

    /**
     * @throws NotFoundException        if neither the queue nor the tracker knows the job.
     * @throws DownloadExpiredException if the job finished and its download window has passed.
     */
    public JobStatusResponse getStatus(final String jobId) {
        Optional<JobRecord> record = queueManager.get(jobId);
        Optional<JobStatus> status = statusTracker.get(jobId);
        if (record.isEmpty() && status.isEmpty()) {
            throw new NotFoundException("Job not found");
        }
        if (isExpired(jobId, record, status)) {
            throw new DownloadExpiredException(jobId);
        }

        JobStatusResponse.JobStatusResponseBuilder response = JobStatusResponse.builder().jobId(jobId);
        status.ifPresent(current -> response.status(current.getStage())
                                            .progress(current.getProgress())
                                            .message(current.getMessage())
                                            .resultPath(current.getResultPath())
                                            .error(current.getError()));
        record.ifPresent(job -> response.lifecycleState(job.getLifecycleState())
                                        .queuePosition(queueManager.queuePosition(jobId))
                                        .estimatedWaitSeconds(queueManager.estimateWait(jobId))
                                        .downloadWindowExpires(job.getDownloadWindowExpires()));
        if (status.isEmpty()) {
            JobRecord job = record.get();
            response.status(stageFor(job.getLifecycleState())).error(job.getLastError());
        }
        return response.build();
    }

    /**
     * Resolves the result file of a finished job. The job is marked downloaded by
     * {@link #completeDownload(String)} once the bytes have been sent.
     *
     * @throws NotFoundException        if the job or its result file is unknown.
     * @throws ConflictException        if the job has not finished yet.
     * @throws DownloadExpiredException if the download window has passed.
     */
    public DownloadableResult prepareDownload(final String jobId) {
        Optional<JobRecord> record = queueManager.get(jobId);
        Optional<JobStatus> status = statusTracker.get(jobId);
        if (record.isEmpty() && status.isEmpty()) {
            throw new NotFoundException("Job not found");
        }
        if (isExpired(jobId, record, status)) {
            throw new DownloadExpiredException(jobId);
        }
        if (record.isEmpty()) {
            throw new NotFoundException("Job not found");
        }

        LifecycleState state = record.get().getLifecycleState();
        if (state == LifecycleState.DOWNLOADED) {
            throw new DownloadExpiredException(jobId);
        }
        if (state != LifecycleState.FINISHED) {
            throw new ConflictException("Job not ready. Current status: " + state.wireName());
        }
        Path result = storageService.outputPath(jobId);
        if (!Files.exists(result)) {
            throw new NotFoundException("Result file not found");
        }
        try {
            return new DownloadableResult(jobId, result, "watermarked_" + jobId + ".pdf", Files.size(result));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read result file of job " + jobId, e);
        }
    }

    /**
     * Marks a served result as downloaded and removes its files right away. The ledger entry stays
     * until the next sweep so repeated requests keep answering as expired.
     */
    public void completeDownload(final String jobId) {
        if (queueManager.markDownloaded(jobId)) {
            storageService.cleanupArtifacts(jobId);
            log.info("[JobId: {}] Result downloaded. Files reclaimed.", jobId);
        }
    }

    /**
     * Removes a job's files, ledger entry and status.
     *
     * @throws NotFoundException if the job is unknown.
     */
    public CleanupResponse cleanup(final String jobId) {
        boolean known = statusTracker.exists(jobId) || queueManager.get(jobId).isPresent();
        if (!known) {
            throw new NotFoundException("Job not found");
        }
        if (!queueManager.delete(jobId)) {
            storageService.cleanupArtifacts(jobId);
        }
        statusTracker.delete(jobId);
        log.info("[JobId: {}] Cleaned up on request.", jobId);
        return new CleanupResponse(String.format("Job %s cleaned up successfully", jobId), 1);
    }

    public JobListingResponse listJobs() {
        Map<String, JobStatus> statuses = statusTracker.getAll();
        return new JobListingResponse(statuses.size(), statusTracker.countActive(), statuses,
                                      queueManager.snapshot());
    }

    public CleanupResponse pruneOldStatuses() {
        int removed = statusTracker.pruneOlderThan(queueConfig.getLifecycle().getStatusRetention());
        return new CleanupResponse(String.format("Cleaned up %d old jobs", removed), removed);
    }

    public HealthResponse health() {
        Map<String, Long> queue = new LinkedHashMap<>();
        queueManager.countByState().forEach((state, count) -> queue.put(state.wireName(), count));
        return new HealthResponse("healthy", statusTracker.countActive(), queue);
    }

    /**
     * Status records live only in memory. Jobs that survived a restart in the ledger get one again so
     * that polling and dispatch keep working for them.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreStatuses() {
        int restored = 0;
        for (JobRecord job : queueManager.snapshot().values()) {
            if (statusTracker.exists(job.getJobId())) {
                continue;
            }
            statusTracker.create(job.getJobId(), "Restored after restart");
            ProcessingStage stage = stageFor(job.getLifecycleState());
            JobStatusUpdate.JobStatusUpdateBuilder update = JobStatusUpdate.builder().stage(stage);
            if (job.getLifecycleState() == LifecycleState.ERROR) {
                update.error(job.getLastError() != null ? job.getLastError() : "Processing failed");
            }
            if (stage == ProcessingStage.FINISHED) {
                update.resultPath(storageService.outputPath(job.getJobId()).toString());
            }
            statusTracker.update(job.getJobId(), update.build());
            restored++;
        }
        if (restored > 0) {
            log.info("Restored status records for {} jobs found in the ledger.", restored);
        }
    }

    private boolean isExpired(final String jobId, final Optional<JobRecord> record, final Optional<JobStatus> status) {
        if (record.isPresent()) {
            return queueManager.isDownloadExpired(jobId);
        }
        return status.map(current -> current.getStage() == ProcessingStage.FINISHED).orElse(false);
    }

    private Path storeUpload(final String jobId, final InputStream content) {
        try {
            storageService.storeUpload(jobId, content);
            return storageService.uploadPath(jobId);
        } catch (IOException e) {
            discard(jobId);
            throw new UncheckedIOException("Failed to store upload for job " + jobId, e);
        }
    }

    private void discard(final String jobId) {
        storageService.cleanupArtifacts(jobId);
        statusTracker.delete(jobId);
    }

    private static ProcessingStage stageFor(final LifecycleState state) {
        return switch (state) {
            case QUEUED -> ProcessingStage.UPLOADING;
            case PROCESSING -> ProcessingStage.SPLITTING;
            case FINISHED, DOWNLOADED -> ProcessingStage.FINISHED;
            case ERROR -> ProcessingStage.ERROR;
        };
    }
}
