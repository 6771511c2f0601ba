package com.eyelevel.watermarks.service.queue;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.model.JobRecord;
import com.eyelevel.watermarks.model.LifecycleState;
import com.eyelevel.watermarks.service.resource.ResourceMonitor;
import com.eyelevel.watermarks.service.status.JobStatusTracker;
import com.eyelevel.watermarks.service.storage.JobStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * The authoritative, persistent ledger of watermarking jobs and the admission logic in front of it.
 * <p>
 * Every operation runs under a single lock, including the snapshot write, so readers never observe
 * a half-applied transition. Records handed out are copies.
 */
@Slf4j
@Service
public class JobQueueManager {

    private static final long MB = 1024L * 1024L;
    private static final Comparator<JobRecord> QUEUE_ORDER =
            Comparator.comparing(JobRecord::getQueuedAt).thenComparing(JobRecord::getJobId);

    private final Map<String, JobRecord> jobs;
    private final ReentrantLock lock = new ReentrantLock();

    private final JobLedgerStore ledgerStore;
    private final ResourceMonitor resourceMonitor;
    private final JobStatusTracker statusTracker;
    private final JobStorageService storageService;
    private final JobQueueConfig config;
    private final Clock clock;

    public JobQueueManager(final JobLedgerStore ledgerStore, final ResourceMonitor resourceMonitor,
                           final JobStatusTracker statusTracker, final JobStorageService storageService,
                           final JobQueueConfig config, final Clock clock) {
        this.ledgerStore = ledgerStore;
        this.resourceMonitor = resourceMonitor;
        this.statusTracker = statusTracker;
        this.storageService = storageService;
        this.config = config;
        this.clock = clock;
        this.jobs = new LinkedHashMap<>(ledgerStore.load());
        failInterruptedJobs();
    }

    /**
     * Decides whether an upload of {@code declaredSize} bytes may enter the queue. Disk headroom is
     * checked first, then the memory floor. Never mutates the ledger.
     *
     * @param ownerId      The submitting session, for logging.
     * @param declaredSize The upload size in bytes.
     * @return The decision, with a reason and retry hint when rejected.
     */
    public AdmissionDecision canAdmit(final String ownerId, final long declaredSize) {
        lock.lock();
        try {
            JobQueueConfig.Admission admission = config.getAdmission();
            long requiredDisk = 2 * declaredSize + admission.getDiskSafetyBuffer().toBytes();
            long freeDisk;
            try {
                freeDisk = resourceMonitor.freeDiskBytes(storageService.rootDir());
            } catch (UncheckedIOException e) {
                log.warn("Admission rejected for owner {}: disk space could not be determined.", ownerId, e);
                return AdmissionDecision.reject(AdmissionRejectionReason.DISK_SPACE,
                                                "Error checking disk space: " + e.getMessage(), diskRetryHint());
            }
            if (freeDisk <= requiredDisk) {
                String message = String.format("Insufficient disk space. Available: %dMB, Required: %dMB",
                                               freeDisk / MB, requiredDisk / MB);
                log.warn("Admission rejected for owner {}: {}", ownerId, message);
                return AdmissionDecision.reject(AdmissionRejectionReason.DISK_SPACE, message, diskRetryHint());
            }

            long availableRam = resourceMonitor.availableMemoryBytes();
            if (availableRam < admission.getMinFreeRam().toBytes()) {
                log.warn("Admission rejected for owner {}: only {}MB of memory available.", ownerId,
                         availableRam / MB);
                return AdmissionDecision.reject(AdmissionRejectionReason.MEMORY,
                                                "Server memory insufficient. Please try again shortly.",
                                                memoryRetryHint());
            }
            return AdmissionDecision.admit();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a queued job. Callers must have passed {@link #canAdmit(String, long)} first.
     */
    public JobRecord add(final String jobId, final String ownerId, final String sourcePath, final long declaredSize,
                         final int chunkSize) {
        lock.lock();
        try {
            JobRecord job = JobRecord.builder()
                                     .jobId(jobId)
                                     .ownerId(ownerId)
                                     .sourcePath(sourcePath)
                                     .declaredSize(declaredSize)
                                     .chunkSize(chunkSize)
                                     .lifecycleState(LifecycleState.QUEUED)
                                     .queuedAt(clock.instant())
                                     .build();
            jobs.put(jobId, job);
            persist();
            log.info("[JobId: {}] Queued at position {} ({} bytes, chunk size {}).", jobId, positionOf(jobId),
                     declaredSize, chunkSize);
            return job.copy();
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobRecord> get(final String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId)).map(JobRecord::copy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the oldest queued job to processing if nothing else is processing and the host has room
     * for it next to every job the pipeline is still working on.
     *
     * @return The started job, or empty if there is nothing to start right now.
     */
    public Optional<JobRecord> popNext() {
        lock.lock();
        try {
            if (jobs.values().stream().anyMatch(job -> job.getLifecycleState() == LifecycleState.PROCESSING)) {
                return Optional.empty();
            }
            Optional<JobRecord> candidate = queuedInOrder().stream().findFirst();
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            JobRecord next = candidate.get();
            if (!hasRoomFor(next)) {
                return Optional.empty();
            }

            next.setLifecycleState(LifecycleState.PROCESSING);
            next.setStartedAt(clock.instant());
            persist();
            log.info("[JobId: {}] Dequeued for processing. {} jobs still waiting.", next.getJobId(),
                     queuedInOrder().size());
            return Optional.of(next.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a processing job as finished and opens its download window.
     *
     * @return {@code false} if the job is unknown or not processing.
     */
    public boolean markFinished(final String jobId) {
        return transition(jobId, LifecycleState.FINISHED, job -> {
            Instant now = clock.instant();
            job.setFinishedAt(now);
            job.setDownloadWindowExpires(now.plus(config.getLifecycle().getDownloadWindow()));
        });
    }

    /**
     * Marks a processing job as failed.
     *
     * @return {@code false} if the job is unknown or not processing.
     */
    public boolean markError(final String jobId, final String message) {
        return transition(jobId, LifecycleState.ERROR, job -> {
            job.setFinishedAt(clock.instant());
            job.setLastError(message);
        });
    }

    /**
     * Records a completed download. The job becomes eligible for the next sweep.
     *
     * @return {@code false} if the job is unknown or not finished.
     */
    public boolean markDownloaded(final String jobId) {
        return transition(jobId, LifecycleState.DOWNLOADED, job -> {
            job.setDownloadedAt(clock.instant());
            job.setDownloadWindowExpires(null);
        });
    }

    /**
     * @return The 1-based rank of a queued job by {@code queuedAt}, or 0 if it is not queued.
     */
    public int queuePosition(final String jobId) {
        lock.lock();
        try {
            return positionOf(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Heuristic wait in seconds: queue position times the average observed processing duration.
     * Returns 0 for jobs that are not queued.
     */
    public long estimateWait(final String jobId) {
        lock.lock();
        try {
            int position = positionOf(jobId);
            return position == 0 ? 0 : position * averageProcessingSecondsLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The mean {@code finishedAt - startedAt} of the most recently completed jobs, or the
     * configured default when none has completed yet.
     */
    public long averageProcessingSeconds() {
        lock.lock();
        try {
            return averageProcessingSecondsLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes finished jobs whose download window has passed, downloaded jobs and failed jobs past
     * their retention, together with their files.
     *
     * @return The ids of the removed jobs.
     */
    public List<String> sweepExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> expired = jobs.values().stream()
                                       .filter(job -> isReclaimable(job, now))
                                       .map(JobRecord::getJobId)
                                       .toList();
            if (expired.isEmpty()) {
                return expired;
            }
            for (String jobId : expired) {
                JobRecord removed = jobs.remove(jobId);
                storageService.cleanupArtifacts(jobId);
                log.info("[JobId: {}] Reclaimed {} job.", jobId, removed.getLifecycleState().wireName());
            }
            persist();
            return expired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a job and its files regardless of its state. A processing job keeps running; its
     * later transitions are refused because the record is gone.
     *
     * @return {@code false} if the job was unknown.
     */
    public boolean delete(final String jobId) {
        lock.lock();
        try {
            JobRecord removed = jobs.remove(jobId);
            if (removed == null) {
                return false;
            }
            storageService.cleanupArtifacts(jobId);
            persist();
            log.info("[JobId: {}] Deleted from the queue in state '{}'.", jobId,
                     removed.getLifecycleState().wireName());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the job is finished but its download window has already passed.
     */
    public boolean isDownloadExpired(final String jobId) {
        lock.lock();
        try {
            JobRecord job = jobs.get(jobId);
            return job != null && job.getLifecycleState() == LifecycleState.FINISHED && isWindowClosed(job,
                                                                                                      clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public Map<LifecycleState, Long> countByState() {
        lock.lock();
        try {
            Map<LifecycleState, Long> counts = new EnumMap<>(LifecycleState.class);
            for (LifecycleState state : LifecycleState.values()) {
                counts.put(state, 0L);
            }
            jobs.values().forEach(job -> counts.merge(job.getLifecycleState(), 1L, Long::sum));
            return counts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return Copies of every record, in insertion order.
     */
    public Map<String, JobRecord> snapshot() {
        lock.lock();
        try {
            return jobs.values().stream()
                       .collect(Collectors.toMap(JobRecord::getJobId, JobRecord::copy, (a, b) -> a,
                                                 LinkedHashMap::new));
        } finally {
            lock.unlock();
        }
    }

    private boolean transition(final String jobId, final LifecycleState target, final Consumer<JobRecord> stamp) {
        lock.lock();
        try {
            JobRecord job = jobs.get(jobId);
            if (job == null) {
                log.warn("[JobId: {}] Refusing transition to '{}': job is not in the queue.", jobId,
                         target.wireName());
                return false;
            }
            LifecycleState current = job.getLifecycleState();
            if (!current.canTransitionTo(target)) {
                log.warn("[JobId: {}] Refusing illegal transition '{}' -> '{}'.", jobId, current.wireName(),
                         target.wireName());
                return false;
            }
            job.setLifecycleState(target);
            stamp.accept(job);
            persist();
            log.info("[JobId: {}] Lifecycle '{}' -> '{}'.", jobId, current.wireName(), target.wireName());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean hasRoomFor(final JobRecord next) {
        JobQueueConfig.Admission admission = config.getAdmission();
        Set<String> activeIds = new HashSet<>(statusTracker.pipelineActiveJobIds());
        long usedRam = 0;
        long usedDisk = 0;
        for (JobRecord job : jobs.values()) {
            if (job.getLifecycleState() == LifecycleState.PROCESSING || activeIds.contains(job.getJobId())) {
                usedRam += (long) (job.getDeclaredSize() * admission.getRamMultiplier());
                usedDisk += (long) (job.getDeclaredSize() * admission.getDiskMultiplier());
            }
        }
        long neededRam = (long) (next.getDeclaredSize() * admission.getRamMultiplier());
        long neededDisk = (long) (next.getDeclaredSize() * admission.getDiskMultiplier());

        long availableRam = resourceMonitor.availableMemoryBytes();
        if (availableRam - usedRam - neededRam < admission.getRamBuffer().toBytes()) {
            log.debug("[JobId: {}] Waiting for memory: available {}MB, in use {}MB, needed {}MB.", next.getJobId(),
                      availableRam / MB, usedRam / MB, neededRam / MB);
            return false;
        }
        long freeDisk;
        try {
            freeDisk = resourceMonitor.freeDiskBytes(storageService.rootDir());
        } catch (UncheckedIOException e) {
            log.warn("[JobId: {}] Free disk space could not be determined. Deferring dispatch.", next.getJobId(), e);
            return false;
        }
        if (freeDisk - usedDisk - neededDisk < admission.getDiskBuffer().toBytes()) {
            log.debug("[JobId: {}] Waiting for disk: free {}MB, in use {}MB, needed {}MB.", next.getJobId(),
                      freeDisk / MB, usedDisk / MB, neededDisk / MB);
            return false;
        }
        return true;
    }

    private List<JobRecord> queuedInOrder() {
        return jobs.values().stream()
                   .filter(job -> job.getLifecycleState() == LifecycleState.QUEUED)
                   .sorted(QUEUE_ORDER)
                   .toList();
    }

    private int positionOf(final String jobId) {
        List<JobRecord> queued = queuedInOrder();
        for (int i = 0; i < queued.size(); i++) {
            if (queued.get(i).getJobId().equals(jobId)) {
                return i + 1;
            }
        }
        return 0;
    }

    private long averageProcessingSecondsLocked() {
        List<Duration> recent = jobs.values().stream()
                                    .filter(job -> job.getLifecycleState() == LifecycleState.FINISHED
                                                   || job.getLifecycleState() == LifecycleState.DOWNLOADED)
                                    .filter(job -> job.getStartedAt() != null && job.getFinishedAt() != null)
                                    .sorted(Comparator.comparing(JobRecord::getFinishedAt).reversed())
                                    .limit(Math.max(1, config.getEstimation().getAverageWindow()))
                                    .map(job -> Duration.between(job.getStartedAt(), job.getFinishedAt()))
                                    .toList();
        if (recent.isEmpty()) {
            return config.getEstimation().getDefaultProcessingSeconds();
        }
        long totalSeconds = recent.stream().mapToLong(Duration::getSeconds).sum();
        return totalSeconds / recent.size();
    }

    private long diskRetryHint() {
        return isProcessing() ? averageProcessingSecondsLocked() : config.getEstimation().getIdleDiskRetrySeconds();
    }

    private long memoryRetryHint() {
        return isProcessing() ? averageProcessingSecondsLocked() : config.getEstimation().getIdleMemoryRetrySeconds();
    }

    private boolean isProcessing() {
        return jobs.values().stream().anyMatch(job -> job.getLifecycleState() == LifecycleState.PROCESSING);
    }

    private boolean isReclaimable(final JobRecord job, final Instant now) {
        return switch (job.getLifecycleState()) {
            case FINISHED -> isWindowClosed(job, now);
            case DOWNLOADED -> true;
            case ERROR -> job.getFinishedAt() != null
                          && now.isAfter(job.getFinishedAt().plus(config.getLifecycle().getErrorRetention()));
            case QUEUED, PROCESSING -> false;
        };
    }

    private boolean isWindowClosed(final JobRecord job, final Instant now) {
        return job.getDownloadWindowExpires() != null && now.isAfter(job.getDownloadWindowExpires());
    }

    /**
     * Jobs left in processing by a previous run can never finish, so they are failed on startup.
     */
    private void failInterruptedJobs() {
        List<String> interrupted = jobs.values().stream()
                                       .filter(job -> job.getLifecycleState() == LifecycleState.PROCESSING)
                                       .map(JobRecord::getJobId)
                                       .toList();
        interrupted.forEach(jobId -> {
            log.warn("[JobId: {}] Found in processing at startup. Marking it as failed.", jobId);
            markError(jobId, "Processing was interrupted by a server restart");
        });
    }

    private void persist() {
        try {
            ledgerStore.save(jobs);
        } catch (IOException e) {
            log.error("❌ Failed to persist the job ledger. The in-memory queue remains authoritative.", e);
        }
    }
}
