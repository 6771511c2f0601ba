package com.eyelevel.watermarks.service.storage;

import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Owns the on-disk layout of the service. Every artifact of a job lives at a path derived from its
 * id, so a job can always be reclaimed from the id alone:
 * <pre>
 *   {tempDir}/uploads/{jobId}.pdf
 *   {tempDir}/processing/{jobId}/chunks/chunk_NNNN.pdf
 *   {tempDir}/processing/{jobId}/watermarked/watermarked_chunk_NNNN.pdf
 *   {tempDir}/outputs/watermarked_{jobId}.pdf
 * </pre>
 */
@Slf4j
@Service
public class JobStorageService {

    private final Path rootDir;
    private final Path uploadDir;
    private final Path processingDir;
    private final Path outputDir;

    public JobStorageService(final WatermarkProcessingConfig config) {
        WatermarkProcessingConfig.Storage storage = config.getStorage();
        this.rootDir = Path.of(storage.getTempDir());
        this.uploadDir = rootDir.resolve(storage.getUploadDir());
        this.processingDir = rootDir.resolve(storage.getProcessingDir());
        this.outputDir = rootDir.resolve(storage.getOutputDir());
    }

    /**
     * Creates the working directories if they are missing.
     */
    @PostConstruct
    public void ensureDirectoriesExist() {
        try {
            Files.createDirectories(uploadDir);
            Files.createDirectories(processingDir);
            Files.createDirectories(outputDir);
            log.info("📁 Working directory ready at '{}'.", rootDir.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create working directories under " + rootDir, e);
        }
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path uploadPath(final String jobId) {
        return uploadDir.resolve(jobId + ".pdf");
    }

    public Path jobWorkDir(final String jobId) {
        return processingDir.resolve(jobId);
    }

    public Path chunksDir(final String jobId) {
        return jobWorkDir(jobId).resolve("chunks");
    }

    public Path watermarkedDir(final String jobId) {
        return jobWorkDir(jobId).resolve("watermarked");
    }

    public Path outputPath(final String jobId) {
        return outputDir.resolve("watermarked_" + jobId + ".pdf");
    }

    /**
     * Streams an upload to its final location, replacing any previous file for the same job.
     *
     * @return The number of bytes written.
     */
    public long storeUpload(final String jobId, final InputStream content) throws IOException {
        Path target = uploadPath(jobId);
        Files.createDirectories(target.getParent());
        long written = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("[JobId: {}] Stored upload of {} bytes at '{}'.", jobId, written, target);
        return written;
    }

    /**
     * Removes the intermediate chunk files of a job but keeps the upload and the result.
     */
    public void cleanupWorkingFiles(final String jobId) {
        Path workDir = jobWorkDir(jobId);
        try {
            if (Files.exists(workDir)) {
                FileUtils.deleteDirectory(workDir.toFile());
                log.debug("[JobId: {}] Removed working directory '{}'.", jobId, workDir);
            }
        } catch (IOException e) {
            log.error("[JobId: {}] Failed to clean up working directory: {}", jobId, workDir, e);
        }
    }

    /**
     * Deletes a partial or unwanted result file.
     */
    public void discardResult(final String jobId) {
        Path output = outputPath(jobId);
        try {
            if (Files.deleteIfExists(output)) {
                log.debug("[JobId: {}] Discarded result '{}'.", jobId, output);
            }
        } catch (IOException e) {
            log.error("[JobId: {}] Failed to discard result '{}'.", jobId, output, e);
        }
    }

    /**
     * Removes every artifact of a job: working files, the upload and the result.
     *
     * @return {@code true} if everything that existed was removed.
     */
    public boolean cleanupArtifacts(final String jobId) {
        boolean clean = true;
        cleanupWorkingFiles(jobId);
        if (Files.exists(jobWorkDir(jobId))) {
            clean = false;
        }
        for (Path file : new Path[]{uploadPath(jobId), outputPath(jobId)}) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                clean = false;
                log.error("[JobId: {}] Failed to delete artifact '{}'.", jobId, file, e);
            }
        }
        if (clean) {
            log.debug("[JobId: {}] All artifacts removed.", jobId);
        }
        return clean;
    }
}
