package com.eyelevel.watermarks.service.queue;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.model.JobRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists the job ledger as a single JSON object keyed by job id. Each snapshot is written to a
 * sibling temp file first and then moved over the previous one, so a crash mid-write never leaves a
 * truncated ledger behind.
 */
@Slf4j
@Component
public class JobLedgerStore {

    private static final TypeReference<LinkedHashMap<String, JobRecord>> LEDGER_TYPE = new TypeReference<>() {
    };

    private final Path ledgerFile;
    private final ObjectMapper objectMapper;

    public JobLedgerStore(final JobQueueConfig config) {
        this.ledgerFile = Path.of(config.getLedgerFile());
        this.objectMapper = JsonMapper.builder()
                                      .addModule(new JavaTimeModule())
                                      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                      .enable(SerializationFeature.INDENT_OUTPUT)
                                      .build();
    }

    /**
     * Reads the last snapshot. An absent, unreadable or corrupt file yields an empty ledger.
     *
     * @return The persisted jobs in file order.
     */
    public Map<String, JobRecord> load() {
        if (!Files.exists(ledgerFile)) {
            log.info("✅ No job ledger at '{}'. Starting with an empty queue.", ledgerFile);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, JobRecord> jobs = objectMapper.readValue(ledgerFile.toFile(), LEDGER_TYPE);
            if (jobs == null) {
                return new LinkedHashMap<>();
            }
            jobs.values().removeIf(job -> job == null || job.getJobId() == null || job.getLifecycleState() == null);
            log.info("✅ Loaded {} jobs from ledger '{}'.", jobs.size(), ledgerFile);
            return jobs;
        } catch (IOException | IllegalArgumentException e) {
            log.error("⚠️ Could not read job ledger '{}'. Starting with an empty queue.", ledgerFile, e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Replaces the snapshot with {@code jobs}.
     *
     * @param jobs The complete ledger.
     * @throws IOException if the snapshot cannot be written after all attempts.
     */
    @Retryable(retryFor = IOException.class,
            maxAttemptsExpression = "#{${app.queue.ledger-retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.queue.ledger-retry.delay-ms:50}}"),
            listeners = {"ledgerRetryListener"})
    public void save(final Map<String, JobRecord> jobs) throws IOException {
        Path parent = ledgerFile.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, ledgerFile.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(tempFile.toFile(), jobs);
            moveIntoPlace(tempFile);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    @Recover
    public void recover(final IOException e, final Map<String, JobRecord> jobs) {
        log.error("❌ Failed to persist the job ledger with {} jobs after all retry attempts. "
                  + "The in-memory queue remains authoritative.", jobs.size(), e);
    }

    public Path getLedgerFile() {
        return ledgerFile;
    }

    private void moveIntoPlace(final Path tempFile) throws IOException {
        try {
            Files.move(tempFile, ledgerFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
