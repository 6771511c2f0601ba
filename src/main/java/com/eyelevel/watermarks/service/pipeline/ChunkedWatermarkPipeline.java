package com.eyelevel.watermarks.service.pipeline;

import com.eyelevel.watermarks.exception.PipelineException;
import com.eyelevel.watermarks.model.ChunkInfo;
import com.eyelevel.watermarks.model.ChunkStatus;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.eyelevel.watermarks.service.storage.JobStorageService;
import com.eyelevel.watermarks.service.watermark.PageTransformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs one job through split, parallel watermark and ordered merge.
 * <p>
 * Chunks are watermarked concurrently on the bounded chunk worker pool, but the merged result always
 * follows the original page order. The pipeline waits for every submitted chunk before deciding the
 * outcome; the first failed chunk in page order becomes the job's failure.
 */
@Slf4j
@Service
public class ChunkedWatermarkPipeline {

    private final PdfChunkSplitter splitter;
    private final PdfChunkMerger merger;
    private final PageTransformer transformer;
    private final JobStorageService storageService;
    private final AsyncTaskExecutor workerPool;

    public ChunkedWatermarkPipeline(final PdfChunkSplitter splitter, final PdfChunkMerger merger,
                                    final PageTransformer transformer, final JobStorageService storageService,
                                    @Qualifier("chunkWorkerExecutor") final AsyncTaskExecutor workerPool) {
        this.splitter = splitter;
        this.merger = merger;
        this.transformer = transformer;
        this.storageService = storageService;
        this.workerPool = workerPool;
    }

    /**
     * Watermarks a document end to end.
     *
     * @param jobId      The job identifier; also names the working directory and the output file.
     * @param sourcePath The uploaded PDF.
     * @param chunkSize  Requested pages per chunk.
     * @param progress   Receives stage changes and merge progress.
     * @return The path of the merged, watermarked document.
     * @throws PipelineException if any phase fails. Nothing is retried.
     */
    public Path run(final String jobId, final Path sourcePath, final int chunkSize, final ProgressCallback progress) {
        long startTime = System.currentTimeMillis();

        progress.report(ProcessingStage.SPLITTING);
        List<ChunkInfo> chunks = splitter.split(jobId, sourcePath, chunkSize, storageService.chunksDir(jobId));
        log.info("[JobId: {}] Split into {} chunks.", jobId, chunks.size());

        progress.report(ProcessingStage.TRANSFORMING);
        List<ChunkInfo> watermarked = watermarkChunks(jobId, chunks, storageService.watermarkedDir(jobId));

        progress.report(ProcessingStage.MERGING, PdfChunkMerger.MERGE_START_PROGRESS);
        List<Path> outputs = watermarked.stream().map(ChunkInfo::getOutputPath).toList();
        Path result = merger.merge(jobId, outputs, storageService.outputPath(jobId), progress);

        progress.report(ProcessingStage.FINISHED);
        log.info("[JobId: {}] Pipeline finished in {} ms. Output: '{}'.", jobId,
                 System.currentTimeMillis() - startTime, result);
        return result;
    }

    private List<ChunkInfo> watermarkChunks(final String jobId, final List<ChunkInfo> chunks, final Path outputDir) {
        List<Future<ChunkInfo>> futures = new ArrayList<>(chunks.size());
        for (ChunkInfo chunk : chunks) {
            futures.add(workerPool.submit(() -> watermarkChunk(jobId, chunk, outputDir)));
        }

        List<ChunkInfo> processed = new ArrayList<>(chunks.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            ChunkInfo chunk = chunks.get(i);
            try {
                processed.add(futures.get(i).get());
            } catch (InterruptedException e) {
                interrupted = true;
                markFailed(chunk, "Interrupted while waiting for the chunk worker");
                processed.add(chunk);
            } catch (ExecutionException e) {
                markFailed(chunk, String.valueOf(e.getCause()));
                processed.add(chunk);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        processed.sort(Comparator.comparingInt(ChunkInfo::getOrder));
        Optional<ChunkInfo> firstFailure = processed.stream()
                                                    .filter(chunk -> chunk.getStatus() != ChunkStatus.COMPLETED)
                                                    .findFirst();
        if (firstFailure.isPresent()) {
            ChunkInfo failed = firstFailure.get();
            throw new PipelineException(String.format("Chunk %d failed: %s", failed.getChunkId(), failed.getError()));
        }
        log.info("[JobId: {}] Watermarked all {} chunks.", jobId, processed.size());
        return processed;
    }

    private ChunkInfo watermarkChunk(final String jobId, final ChunkInfo chunk, final Path outputDir) {
        chunk.setStatus(ChunkStatus.PROCESSING);
        Path outputPath = outputDir.resolve(String.format("watermarked_chunk_%04d.pdf", chunk.getChunkId()));
        try {
            transformer.transform(chunk.getInputPath(), outputPath, chunk.getColor());
            chunk.setOutputPath(outputPath);
            chunk.setStatus(ChunkStatus.COMPLETED);
            log.debug("[JobId: {}] Chunk {} watermarked in {}.", jobId, chunk.getChunkId(), chunk.getColor().toHex());
        } catch (Exception e) {
            log.error("[JobId: {}] Failed to watermark chunk {}.", jobId, chunk.getChunkId(), e);
            markFailed(chunk, e.getMessage());
        }
        return chunk;
    }

    private void markFailed(final ChunkInfo chunk, final String error) {
        chunk.setStatus(ChunkStatus.ERROR);
        chunk.setError(error);
    }
}
