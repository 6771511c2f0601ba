package com.eyelevel.watermarks.service.pipeline;

import com.eyelevel.watermarks.exception.PipelineException;
import com.eyelevel.watermarks.model.ChunkInfo;
import com.eyelevel.watermarks.model.PageRange;
import com.eyelevel.watermarks.service.watermark.WatermarkPalette;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a PDF into chunk files of consecutive pages using PDFBox, and assigns each chunk its
 * watermark color.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfChunkSplitter {

    private final WatermarkPalette palette;

    /**
     * Writes every chunk to {@code outputDir/chunk_NNNN.pdf}. Either all chunks are produced or none
     * are left behind.
     *
     * @param jobId     The job being processed, for logging.
     * @param source    The uploaded document.
     * @param chunkSize Requested pages per chunk.
     * @param outputDir Directory receiving the chunk files.
     * @return Chunks in document order.
     * @throws PipelineException if the source cannot be read, has no pages or a chunk cannot be written.
     */
    public List<ChunkInfo> split(final String jobId, final Path source, final int chunkSize, final Path outputDir) {
        List<ChunkInfo> chunks = new ArrayList<>();
        try (PDDocument document = Loader.loadPDF(source.toFile())) {
            int totalPages = document.getNumberOfPages();
            if (totalPages == 0) {
                throw new PipelineException("Failed to split PDF into chunks: the document contains no pages");
            }
            List<PageRange> ranges = ChunkPlanner.plan(totalPages, chunkSize);
            log.info("[JobId: {}] Splitting PDF with {} pages into {} chunks of max {} pages.", jobId, totalPages,
                     ranges.size(), ranges.get(0).size());
            Files.createDirectories(outputDir);

            for (int chunkId = 0; chunkId < ranges.size(); chunkId++) {
                PageRange range = ranges.get(chunkId);
                Path chunkPath = outputDir.resolve(String.format("chunk_%04d.pdf", chunkId));
                try (PDDocument chunkDoc = new PDDocument()) {
                    for (int page = range.start(); page < range.end(); page++) {
                        chunkDoc.addPage(document.getPage(page));
                    }
                    chunkDoc.save(chunkPath.toFile());
                }
                chunks.add(ChunkInfo.builder()
                                    .chunkId(chunkId)
                                    .order(chunkId)
                                    .startPage(range.start())
                                    .endPage(range.end())
                                    .inputPath(chunkPath)
                                    .color(palette.colorForChunk(chunkId))
                                    .build());
                log.debug("[JobId: {}] Created chunk {} (pages {}-{}).", jobId, chunkId, range.start() + 1, range.end());
            }
            return chunks;
        } catch (PipelineException e) {
            cleanup(chunks);
            throw e;
        } catch (IOException | RuntimeException e) {
            cleanup(chunks);
            throw new PipelineException("Failed to split PDF into chunks: " + e.getMessage(), e);
        }
    }

    /**
     * @return The page count of a PDF.
     * @throws IOException if the file is not a readable PDF.
     */
    public int countPages(final Path pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            return document.getNumberOfPages();
        }
    }

    private void cleanup(final List<ChunkInfo> chunks) {
        chunks.forEach(chunk -> {
            try {
                Files.deleteIfExists(chunk.getInputPath());
            } catch (IOException ex) {
                log.warn("Failed to clean up split artifact: {}", chunk.getInputPath());
            }
        });
    }
}
