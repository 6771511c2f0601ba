package com.eyelevel.watermarks.service.watermark;

import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.model.WatermarkColor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.state.PDExtendedGraphicsState;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stamps a translucent, rotated text watermark in the centre of every page of a chunk using PDFBox.
 * Each call works on its own document, so concurrent calls do not share any PDFBox state.
 */
@Slf4j
@Component
public class PdfBoxWatermarkRenderer implements PageTransformer {

    private final WatermarkProcessingConfig.Watermark settings;

    public PdfBoxWatermarkRenderer(final WatermarkProcessingConfig config) {
        this.settings = config.getWatermark();
    }

    @Override
    public void transform(final Path chunkPath, final Path outputPath, final WatermarkColor color)
    throws IOException {
        Files.createDirectories(outputPath.toAbsolutePath().getParent());
        try (PDDocument document = Loader.loadPDF(chunkPath.toFile())) {
            PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            PDExtendedGraphicsState translucent = new PDExtendedGraphicsState();
            translucent.setNonStrokingAlphaConstant(settings.getOpacity());

            float fontSize = settings.getFontSize();
            float textWidth = font.getStringWidth(settings.getText()) / 1000f * fontSize;

            for (PDPage page : document.getPages()) {
                stampPage(document, page, font, translucent, textWidth, color);
            }
            document.save(outputPath.toFile());
            log.trace("Watermarked {} pages of '{}' in {}.", document.getNumberOfPages(), chunkPath.getFileName(),
                      color.toHex());
        }
    }

    private void stampPage(final PDDocument document, final PDPage page, final PDFont font,
                           final PDExtendedGraphicsState translucent, final float textWidth,
                           final WatermarkColor color) throws IOException {
        PDRectangle box = page.getMediaBox();
        float centerX = box.getLowerLeftX() + box.getWidth() / 2f;
        float centerY = box.getLowerLeftY() + box.getHeight() / 2f;

        try (PDPageContentStream stream = new PDPageContentStream(document, page,
                                                                  PDPageContentStream.AppendMode.APPEND, true,
                                                                  true)) {
            stream.setGraphicsStateParameters(translucent);
            stream.setNonStrokingColor(color.red(), color.green(), color.blue());
            stream.beginText();
            stream.setFont(font, settings.getFontSize());
            Matrix matrix = Matrix.getRotateInstance(Math.toRadians(settings.getRotationDegrees()), centerX, centerY);
            matrix.translate(-textWidth / 2f, 0f);
            stream.setTextMatrix(matrix);
            stream.showText(settings.getText());
            stream.endText();
        }
    }
}
