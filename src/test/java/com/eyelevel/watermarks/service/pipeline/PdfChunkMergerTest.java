package com.eyelevel.watermarks.service.pipeline;

import com.eyelevel.watermarks.exception.PipelineException;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.eyelevel.watermarks.support.TestPdfs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfChunkMergerTest {

    @TempDir
    Path workDir;

    private final PdfChunkMerger merger = new PdfChunkMerger();

    @Test
    @DisplayName("appends chunks in the given order and reports merge progress")
    void mergesInOrder() throws IOException {
        Path first = TestPdfs.create(workDir.resolve("a.pdf"), 2);
        Path second = TestPdfs.create(workDir.resolve("b.pdf"), 3);
        Path output = workDir.resolve("out/merged.pdf");
        List<Integer> reported = new ArrayList<>();

        Path result = merger.merge("job-1", List.of(first, second), output, (stage, progress) -> {
            assertEquals(ProcessingStage.MERGING, stage);
            reported.add(progress);
        });

        assertEquals(output, result);
        assertEquals(5, TestPdfs.pageCount(output));
        assertEquals(List.of(87, 95, 95, 100), reported);
        try (PDDocument merged = Loader.loadPDF(output.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(3);
            stripper.setEndPage(3);
            assertTrue(stripper.getText(merged).contains("Page 1"), "third page is the first page of the second chunk");
        }
    }

    @Test
    @DisplayName("skips per-chunk progress for a single chunk")
    void singleChunkProgress() throws IOException {
        Path only = TestPdfs.create(workDir.resolve("only.pdf"), 4);
        List<Integer> reported = new ArrayList<>();

        merger.merge("job-1", List.of(only), workDir.resolve("merged.pdf"), (stage, progress) -> reported.add(progress));

        assertEquals(List.of(95, 100), reported);
    }

    @Test
    @DisplayName("fails when a chunk file is missing")
    void missingChunk() throws IOException {
        Path present = TestPdfs.create(workDir.resolve("a.pdf"), 1);
        Path missing = workDir.resolve("missing.pdf");
        Path output = workDir.resolve("merged.pdf");

        PipelineException e = assertThrows(PipelineException.class,
                                           () -> merger.merge("job-1", List.of(present, missing), output,
                                                              ProgressCallback.noop()));

        assertTrue(e.getMessage().contains("chunk file not found"));
        assertFalse(Files.exists(output));
    }
}
