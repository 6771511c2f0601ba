package com.eyelevel.watermarks.service.watermark;

import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.model.WatermarkColor;
import com.eyelevel.watermarks.support.TestPdfs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfBoxWatermarkRendererTest {

    @TempDir
    Path workDir;

    @Test
    @DisplayName("stamps the watermark text on every page with a translucent graphics state")
    void stampsEveryPage() throws IOException {
        WatermarkProcessingConfig config = new WatermarkProcessingConfig();
        config.getWatermark().setText("CONFIDENTIAL");
        config.getWatermark().setRotationDegrees(0f);
        PdfBoxWatermarkRenderer renderer = new PdfBoxWatermarkRenderer(config);
        Path chunk = TestPdfs.create(workDir.resolve("chunk_0000.pdf"), 3);
        Path output = workDir.resolve("watermarked/watermarked_chunk_0000.pdf");

        renderer.transform(chunk, output, WatermarkColor.fromHex("#0000FF"));

        try (PDDocument document = Loader.loadPDF(output.toFile())) {
            assertEquals(3, document.getNumberOfPages());
            for (PDPage page : document.getPages()) {
                assertTrue(page.getResources().getExtGStateNames().iterator().hasNext());
            }
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("CONFIDENTIAL"));
            assertTrue(text.contains("Page 2"), "original content is preserved");
        }
    }

    @Test
    @DisplayName("fails with an IOException for an unreadable chunk")
    void unreadableChunk() throws IOException {
        PdfBoxWatermarkRenderer renderer = new PdfBoxWatermarkRenderer(new WatermarkProcessingConfig());
        Path chunk = Files.writeString(workDir.resolve("chunk_0000.pdf"), "nope");

        assertThrows(IOException.class,
                     () -> renderer.transform(chunk, workDir.resolve("out.pdf"), WatermarkColor.fromHex("#FF0000")));
    }

    @Test
    @DisplayName("palette wraps around after its last color")
    void paletteWraps() {
        WatermarkColor red = WatermarkColor.fromHex("#FF0000");
        WatermarkColor green = WatermarkColor.fromHex("#008000");
        WatermarkPalette palette = new WatermarkPalette(List.of(red, green));

        assertEquals(red, palette.colorForChunk(0));
        assertEquals(green, palette.colorForChunk(1));
        assertEquals(red, palette.colorForChunk(2));
        assertEquals("#008000", green.toHex());
        assertThrows(IllegalArgumentException.class, () -> new WatermarkPalette(List.of()));
    }
}
