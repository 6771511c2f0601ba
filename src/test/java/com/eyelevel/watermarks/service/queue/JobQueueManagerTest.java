package com.eyelevel.watermarks.service.queue;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.model.JobRecord;
import com.eyelevel.watermarks.model.LifecycleState;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.eyelevel.watermarks.service.status.JobStatusTracker;
import com.eyelevel.watermarks.service.status.JobStatusUpdate;
import com.eyelevel.watermarks.service.storage.JobStorageService;
import com.eyelevel.watermarks.support.FakeResourceMonitor;
import com.eyelevel.watermarks.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.eyelevel.watermarks.support.FakeResourceMonitor.GB;
import static com.eyelevel.watermarks.support.FakeResourceMonitor.MB;
import static org.junit.jupiter.api.Assertions.*;

class JobQueueManagerTest {

    @TempDir
    Path workDir;

    private MutableClock clock;
    private FakeResourceMonitor resources;
    private JobQueueConfig queueConfig;
    private JobStatusTracker statusTracker;
    private JobStorageService storageService;
    private JobLedgerStore ledgerStore;
    private JobQueueManager queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-15T10:00:00Z");
        resources = FakeResourceMonitor.plenty();

        queueConfig = new JobQueueConfig();
        queueConfig.setLedgerFile(workDir.resolve("queue.json").toString());

        WatermarkProcessingConfig processingConfig = new WatermarkProcessingConfig();
        processingConfig.getStorage().setTempDir(workDir.toString());
        storageService = new JobStorageService(processingConfig);
        storageService.ensureDirectoriesExist();

        statusTracker = new JobStatusTracker(clock);
        ledgerStore = new JobLedgerStore(queueConfig);
        queue = newQueue();
    }

    private JobQueueManager newQueue() {
        return new JobQueueManager(ledgerStore, resources, statusTracker, storageService, queueConfig, clock);
    }

    private JobRecord enqueue(final String jobId, final long size) {
        JobRecord job = queue.add(jobId, "owner-abcdefghijk", storageService.uploadPath(jobId).toString(), size, 10);
        clock.advance(Duration.ofSeconds(1));
        return job;
    }

    @Nested
    @DisplayName("Admission")
    class Admission {

        @Test
        @DisplayName("rejects with disk_space when free disk does not exceed twice the size plus the buffer")
        void rejectsWhenDiskIsShort() {
            resources.setFreeDisk(150 * MB);

            AdmissionDecision decision = queue.canAdmit("owner", 100 * MB);

            assertFalse(decision.admitted());
            assertEquals(AdmissionRejectionReason.DISK_SPACE, decision.reason());
            assertTrue(decision.message().startsWith("Insufficient disk space"));
            assertEquals(300, decision.retryAfterSeconds(), "idle server suggests the disk default");
        }

        @Test
        @DisplayName("rejects with memory when available memory is below the floor")
        void rejectsWhenMemoryIsShort() {
            resources.setAvailableMemory(50 * MB);

            AdmissionDecision decision = queue.canAdmit("owner", 10 * MB);

            assertFalse(decision.admitted());
            assertEquals(AdmissionRejectionReason.MEMORY, decision.reason());
            assertEquals(60, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("checks disk before memory")
        void diskIsCheckedFirst() {
            resources.setFreeDisk(10 * MB);
            resources.setAvailableMemory(10 * MB);

            assertEquals(AdmissionRejectionReason.DISK_SPACE, queue.canAdmit("owner", 10 * MB).reason());
        }

        @Test
        @DisplayName("treats a failing disk probe as a disk_space rejection")
        void diskProbeFailureRejects() {
            resources.setDiskProbeFails(true);

            AdmissionDecision decision = queue.canAdmit("owner", MB);

            assertFalse(decision.admitted());
            assertEquals(AdmissionRejectionReason.DISK_SPACE, decision.reason());
        }

        @Test
        @DisplayName("suggests the average processing time while a job is running")
        void retryHintFollowsProcessing() {
            enqueue("job-1", MB);
            assertTrue(queue.popNext().isPresent());
            resources.setAvailableMemory(10 * MB);

            AdmissionDecision decision = queue.canAdmit("owner", MB);

            assertEquals(120, decision.retryAfterSeconds(), "no completed job yet, so the default applies");
        }

        @Test
        @DisplayName("admits without touching the ledger")
        void admitsWithoutMutation() {
            AdmissionDecision decision = queue.canAdmit("owner", 10 * MB);

            assertTrue(decision.admitted());
            assertNull(decision.reason());
            assertTrue(queue.snapshot().isEmpty());
            assertFalse(Files.exists(ledgerStore.getLedgerFile()));
        }
    }

    @Nested
    @DisplayName("Ordering and dispatch")
    class Dispatch {

        @Test
        @DisplayName("positions follow queuedAt and shift when the head leaves")
        void fifoPositions() {
            enqueue("job-1", MB);
            enqueue("job-2", MB);
            enqueue("job-3", MB);

            assertEquals(1, queue.queuePosition("job-1"));
            assertEquals(2, queue.queuePosition("job-2"));
            assertEquals(3, queue.queuePosition("job-3"));

            Optional<JobRecord> started = queue.popNext();
            assertEquals("job-1", started.orElseThrow().getJobId());
            assertEquals(0, queue.queuePosition("job-1"));
            assertEquals(1, queue.queuePosition("job-2"));
            assertEquals(2, queue.queuePosition("job-3"));
        }

        @Test
        @DisplayName("ties on queuedAt are broken by job id")
        void tiesBrokenById() {
            queue.add("job-b", "owner-abcdefghijk", "b.pdf", MB, 10);
            queue.add("job-a", "owner-abcdefghijk", "a.pdf", MB, 10);

            assertEquals(1, queue.queuePosition("job-a"));
            assertEquals(2, queue.queuePosition("job-b"));
        }

        @Test
        @DisplayName("never has more than one job processing")
        void singleProcessingJob() {
            enqueue("job-1", MB);
            enqueue("job-2", MB);

            assertTrue(queue.popNext().isPresent());
            assertTrue(queue.popNext().isEmpty());
            assertEquals(1L, queue.countByState().get(LifecycleState.PROCESSING));

            queue.markFinished("job-1");
            assertEquals("job-2", queue.popNext().orElseThrow().getJobId());
        }

        @Test
        @DisplayName("stamps startedAt and returns a detached copy")
        void popStampsStart() {
            enqueue("job-1", MB);

            JobRecord started = queue.popNext().orElseThrow();
            started.setLifecycleState(LifecycleState.ERROR);

            assertEquals(LifecycleState.PROCESSING, queue.get("job-1").orElseThrow().getLifecycleState());
            assertEquals(clock.instant(), queue.get("job-1").orElseThrow().getStartedAt());
        }

        @Test
        @DisplayName("leaves the head queued when memory headroom is insufficient")
        void waitsForMemory() {
            enqueue("job-1", 10 * MB);
            resources.setAvailableMemory(300 * MB);

            assertTrue(queue.popNext().isEmpty());
            assertEquals(LifecycleState.QUEUED, queue.get("job-1").orElseThrow().getLifecycleState());

            resources.setAvailableMemory(GB);
            assertTrue(queue.popNext().isPresent());
        }

        @Test
        @DisplayName("leaves the head queued when disk headroom is insufficient")
        void waitsForDisk() {
            enqueue("job-1", 100 * MB);
            resources.setFreeDisk(400 * MB);

            assertTrue(queue.popNext().isEmpty());

            resources.setFreeDisk(500 * MB);
            assertTrue(queue.popNext().isPresent());
        }

        @Test
        @DisplayName("counts jobs the pipeline still reports as active against the headroom")
        void pipelineActiveJobsConsumeHeadroom() {
            enqueue("job-1", 100 * MB);
            queue.popNext();
            queue.markFinished("job-1");
            statusTracker.create("job-1", "Uploading file");
            statusTracker.update("job-1", JobStatusUpdate.stage(ProcessingStage.MERGING));

            enqueue("job-2", 100 * MB);
            resources.setAvailableMemory(700 * MB);

            assertTrue(queue.popNext().isEmpty(), "250MB in use + 250MB needed leaves less than the 300MB buffer");

            statusTracker.update("job-1", JobStatusUpdate.stage(ProcessingStage.FINISHED));
            assertEquals("job-2", queue.popNext().orElseThrow().getJobId());
        }

        @Test
        @DisplayName("returns empty when nothing is queued")
        void emptyQueue() {
            assertTrue(queue.popNext().isEmpty());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("opens a one minute download window on finish")
        void finishOpensWindow() {
            enqueue("job-1", MB);
            queue.popNext();

            assertTrue(queue.markFinished("job-1"));

            JobRecord job = queue.get("job-1").orElseThrow();
            assertEquals(LifecycleState.FINISHED, job.getLifecycleState());
            assertEquals(clock.instant(), job.getFinishedAt());
            assertEquals(clock.instant().plus(Duration.ofMinutes(1)), job.getDownloadWindowExpires());
        }

        @Test
        @DisplayName("refuses transitions that skip or reverse states")
        void refusesIllegalTransitions() {
            enqueue("job-1", MB);

            assertFalse(queue.markFinished("job-1"), "queued cannot finish");
            assertFalse(queue.markDownloaded("job-1"), "queued cannot be downloaded");
            assertFalse(queue.markError("job-1", "boom"), "queued cannot fail");
            assertEquals(LifecycleState.QUEUED, queue.get("job-1").orElseThrow().getLifecycleState());

            queue.popNext();
            queue.markFinished("job-1");
            assertFalse(queue.markError("job-1", "late"), "finished cannot fail");
            assertTrue(queue.markDownloaded("job-1"));
            assertFalse(queue.markDownloaded("job-1"), "downloaded is terminal");
        }

        @Test
        @DisplayName("refuses transitions for unknown jobs")
        void unknownJob() {
            assertFalse(queue.markFinished("missing"));
            assertFalse(queue.delete("missing"));
            assertTrue(queue.get("missing").isEmpty());
        }

        @Test
        @DisplayName("records the error and finish time of a failed job")
        void markError() {
            enqueue("job-1", MB);
            queue.popNext();

            assertTrue(queue.markError("job-1", "Chunk 2 failed: broken"));

            JobRecord job = queue.get("job-1").orElseThrow();
            assertEquals(LifecycleState.ERROR, job.getLifecycleState());
            assertEquals("Chunk 2 failed: broken", job.getLastError());
            assertNotNull(job.getStartedAt());
            assertNotNull(job.getFinishedAt());
            assertNull(job.getDownloadWindowExpires());
        }

        @Test
        @DisplayName("clears the download window once downloaded")
        void downloadClearsWindow() {
            enqueue("job-1", MB);
            queue.popNext();
            queue.markFinished("job-1");

            queue.markDownloaded("job-1");

            JobRecord job = queue.get("job-1").orElseThrow();
            assertEquals(LifecycleState.DOWNLOADED, job.getLifecycleState());
            assertNull(job.getDownloadWindowExpires());
            assertEquals(clock.instant(), job.getDownloadedAt());
        }

        @Test
        @DisplayName("reports an expired download window only after it has passed")
        void downloadExpiry() {
            enqueue("job-1", MB);
            queue.popNext();
            queue.markFinished("job-1");

            clock.advance(Duration.ofSeconds(59));
            assertFalse(queue.isDownloadExpired("job-1"));

            clock.advance(Duration.ofSeconds(2));
            assertTrue(queue.isDownloadExpired("job-1"));
        }
    }

    @Nested
    @DisplayName("Wait estimation")
    class Estimation {

        @Test
        @DisplayName("uses the default processing time when nothing has completed")
        void defaultEstimate() {
            enqueue("job-1", MB);
            enqueue("job-2", MB);

            assertEquals(120, queue.averageProcessingSeconds());
            assertEquals(120, queue.estimateWait("job-1"));
            assertEquals(240, queue.estimateWait("job-2"));
        }

        @Test
        @DisplayName("multiplies the position by the observed average")
        void observedAverage() {
            enqueue("job-1", MB);
            queue.popNext();
            clock.advance(Duration.ofSeconds(30));
            queue.markFinished("job-1");

            enqueue("job-2", MB);
            queue.popNext();
            clock.advance(Duration.ofSeconds(90));
            queue.markFinished("job-2");

            enqueue("job-3", MB);
            enqueue("job-4", MB);

            assertEquals(60, queue.averageProcessingSeconds());
            assertEquals(120, queue.estimateWait("job-4"));
            assertEquals(0, queue.estimateWait("job-1"), "jobs that are not queued do not wait");
        }

        @Test
        @DisplayName("only averages the most recent completions")
        void averageWindow() {
            queueConfig.getEstimation().setAverageWindow(1);
            enqueue("job-1", MB);
            queue.popNext();
            clock.advance(Duration.ofSeconds(500));
            queue.markFinished("job-1");

            enqueue("job-2", MB);
            queue.popNext();
            clock.advance(Duration.ofSeconds(10));
            queue.markFinished("job-2");

            assertEquals(10, queue.averageProcessingSeconds());
        }
    }

    @Nested
    @DisplayName("Sweep")
    class Sweep {

        @Test
        @DisplayName("reclaims a finished job and its files once the window passes")
        void reclaimsExpiredResult() throws IOException {
            enqueue("job-1", MB);
            queue.popNext();
            queue.markFinished("job-1");
            Path output = storageService.outputPath("job-1");
            Files.writeString(output, "result");

            assertTrue(queue.sweepExpired().isEmpty());

            clock.advance(Duration.ofSeconds(61));
            assertEquals(List.of("job-1"), queue.sweepExpired());
            assertTrue(queue.get("job-1").isEmpty());
            assertFalse(Files.exists(output));
        }

        @Test
        @DisplayName("reclaims downloaded jobs immediately")
        void reclaimsDownloaded() {
            enqueue("job-1", MB);
            queue.popNext();
            queue.markFinished("job-1");
            queue.markDownloaded("job-1");

            assertEquals(List.of("job-1"), queue.sweepExpired());
        }

        @Test
        @DisplayName("keeps failed jobs for the error retention period")
        void keepsErrorsForRetention() {
            enqueue("job-1", MB);
            queue.popNext();
            queue.markError("job-1", "boom");

            clock.advance(Duration.ofMinutes(59));
            assertTrue(queue.sweepExpired().isEmpty());

            clock.advance(Duration.ofMinutes(2));
            assertEquals(List.of("job-1"), queue.sweepExpired());
        }

        @Test
        @DisplayName("never reclaims queued or processing jobs")
        void keepsActiveJobs() {
            enqueue("job-1", MB);
            enqueue("job-2", MB);
            queue.popNext();

            clock.advance(Duration.ofDays(2));

            assertTrue(queue.sweepExpired().isEmpty());
            assertEquals(2, queue.snapshot().size());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("survives a restart with every field intact")
        void reloadsLedger() {
            enqueue("job-1", 5 * MB);
            enqueue("job-2", 6 * MB);
            queue.popNext();
            queue.markFinished("job-1");
            Instant expires = queue.get("job-1").orElseThrow().getDownloadWindowExpires();

            JobQueueManager restarted = newQueue();

            JobRecord finished = restarted.get("job-1").orElseThrow();
            assertEquals(LifecycleState.FINISHED, finished.getLifecycleState());
            assertEquals(expires, finished.getDownloadWindowExpires());
            assertEquals(5 * MB, finished.getDeclaredSize());
            assertEquals("owner-abcdefghijk", finished.getOwnerId());
            assertEquals(1, restarted.queuePosition("job-2"));
        }

        @Test
        @DisplayName("fails jobs that were processing when the previous run stopped")
        void failsInterruptedJobs() {
            enqueue("job-1", MB);
            enqueue("job-2", MB);
            queue.popNext();

            JobQueueManager restarted = newQueue();

            JobRecord interrupted = restarted.get("job-1").orElseThrow();
            assertEquals(LifecycleState.ERROR, interrupted.getLifecycleState());
            assertNotNull(interrupted.getLastError());
            assertEquals("job-2", restarted.popNext().orElseThrow().getJobId());
        }

        @Test
        @DisplayName("starts empty when the ledger is corrupt")
        void corruptLedger() throws IOException {
            Files.writeString(ledgerStore.getLedgerFile(), "{ this is not json");

            JobQueueManager restarted = newQueue();

            assertTrue(restarted.snapshot().isEmpty());
        }

        @Test
        @DisplayName("removes deleted jobs from the ledger and disk")
        void deleteRemovesEverything() throws IOException {
            enqueue("job-1", MB);
            Files.writeString(storageService.uploadPath("job-1"), "upload");

            assertTrue(queue.delete("job-1"));

            assertFalse(Files.exists(storageService.uploadPath("job-1")));
            Map<String, JobRecord> reloaded = ledgerStore.load();
            assertFalse(reloaded.containsKey("job-1"));
        }
    }
}
