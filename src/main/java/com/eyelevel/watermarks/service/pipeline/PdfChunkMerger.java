package com.eyelevel.watermarks.service.pipeline;

import com.eyelevel.watermarks.exception.PipelineException;
import com.eyelevel.watermarks.model.ProcessingStage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends watermarked chunk files into a single PDF, strictly in the order given.
 */
@Slf4j
@Component
public class PdfChunkMerger {

    static final int MERGE_START_PROGRESS = 80;
    static final int MERGE_SPAN = 15;
    static final int BEFORE_WRITE_PROGRESS = 95;
    static final int DONE_PROGRESS = 100;

    /**
     * Merges the chunks, reporting {@code 80..95} while appending (one step per chunk, only when there
     * is more than one), 95 before the write and 100 once the file is on disk.
     *
     * @param jobId      The job being processed, for logging.
     * @param chunkPaths Chunk files in merge order.
     * @param outputPath The merged document to write.
     * @param progress   Receives merge progress.
     * @return {@code outputPath}.
     * @throws PipelineException if a chunk is missing or unreadable or the result cannot be written.
     */
    public Path merge(final String jobId, final List<Path> chunkPaths, final Path outputPath,
                      final ProgressCallback progress) {
        PDFMergerUtility mergerUtility = new PDFMergerUtility();
        List<PDDocument> sources = new ArrayList<>();
        int total = chunkPaths.size();
        try (PDDocument merged = new PDDocument()) {
            for (int i = 0; i < total; i++) {
                Path chunkPath = chunkPaths.get(i);
                if (chunkPath == null || !Files.exists(chunkPath)) {
                    throw new PipelineException("Failed to merge chunks: chunk file not found: " + chunkPath);
                }
                PDDocument source = Loader.loadPDF(chunkPath.toFile());
                sources.add(source);
                mergerUtility.appendDocument(merged, source);

                if (total > 1) {
                    progress.report(ProcessingStage.MERGING,
                                    MERGE_START_PROGRESS + (int) ((i + 1) / (double) total * MERGE_SPAN));
                }
            }

            progress.report(ProcessingStage.MERGING, BEFORE_WRITE_PROGRESS);
            Files.createDirectories(outputPath.toAbsolutePath().getParent());
            merged.save(outputPath.toFile());
            log.info("[JobId: {}] Merged {} chunks ({} pages) into '{}'.", jobId, total, merged.getNumberOfPages(),
                     outputPath);
        } catch (PipelineException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new PipelineException("Failed to merge chunks: " + e.getMessage(), e);
        } finally {
            closeAll(sources);
        }
        progress.report(ProcessingStage.MERGING, DONE_PROGRESS);
        return outputPath;
    }

    private void closeAll(final List<PDDocument> documents) {
        for (PDDocument document : documents) {
            try {
                document.close();
            } catch (IOException e) {
                log.warn("Failed to close a chunk document after merging.", e);
            }
        }
    }
}
