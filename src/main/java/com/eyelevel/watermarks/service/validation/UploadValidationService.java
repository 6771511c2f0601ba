package com.eyelevel.watermarks.service.validation;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.service.resource.ResourceMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Checks uploads before they are admitted: file type, size against the memory-derived limit, and
 * PDF structure. Nothing here touches the queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadValidationService {

    static final String ENCRYPTED_MESSAGE = "The PDF is password-protected. Please upload an unencrypted file.";

    private final ResourceMonitor resourceMonitor;
    private final WatermarkProcessingConfig processingConfig;
    private final JobQueueConfig queueConfig;

    public boolean isAllowedFile(final String filename) {
        if (filename == null || filename.isBlank()) {
            return false;
        }
        String extension = FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
        return processingConfig.getValidation().getAllowedExtensions().contains(extension);
    }

    /**
     * Answers whether a file of {@code fileSize} bytes could be uploaded now. The limit is a share
     * of the available memory, capped by the absolute maximum.
     */
    public SizeAllowance checkSizeAllowance(final long fileSize) {
        long availableRam = resourceMonitor.availableMemoryBytes();
        long maxAllowedSize = maxAllowedSize(availableRam);

        if (availableRam < queueConfig.getAdmission().getMinFreeRam().toBytes()) {
            return new SizeAllowance(false, maxAllowedSize, availableRam,
                                     "Server memory is currently insufficient. Please try again later.");
        }
        if (fileSize <= 0) {
            return new SizeAllowance(false, maxAllowedSize, availableRam,
                                     "Invalid file size. File size must be greater than 0.");
        }
        if (fileSize > maxAllowedSize) {
            return new SizeAllowance(false, maxAllowedSize, availableRam,
                                     String.format("File too large (%s). Maximum allowed: %s",
                                                   FileUtils.byteCountToDisplaySize(fileSize),
                                                   FileUtils.byteCountToDisplaySize(maxAllowedSize)));
        }
        return new SizeAllowance(true, maxAllowedSize, availableRam, "File size is acceptable");
    }

    /**
     * Re-checks the size of a received upload, for clients that skipped the pre-upload check.
     */
    public ValidationResult validateFileSizeOnUpload(final long fileSize) {
        if (!processingConfig.getValidation().isRecheckSizeOnUpload()) {
            return ValidationResult.valid("Size check skipped (disabled in config)");
        }
        long maxAllowedSize = maxAllowedSize(resourceMonitor.availableMemoryBytes());
        if (fileSize > maxAllowedSize) {
            return ValidationResult.invalid(String.format("File size (%s) exceeds server capacity (%s)",
                                                          FileUtils.byteCountToDisplaySize(fileSize),
                                                          FileUtils.byteCountToDisplaySize(maxAllowedSize)));
        }
        return ValidationResult.valid("File size acceptable");
    }

    /**
     * Opens the PDF with PDFBox to reject empty, encrypted and corrupt documents before they are queued.
     *
     * @return A valid result carrying {@code num_pages} and {@code file_size}, or the reason for rejection.
     */
    public ValidationResult validatePdfStructure(final Path file) {
        if (file == null || !Files.exists(file)) {
            return ValidationResult.invalid("File not found");
        }
        long fileSize;
        try {
            fileSize = Files.size(file);
        } catch (IOException e) {
            log.warn("Could not read the size of '{}'.", file, e);
            return ValidationResult.invalid("Error validating PDF: " + e.getMessage());
        }
        if (fileSize == 0) {
            return ValidationResult.invalid("The uploaded file is empty");
        }
        if (!file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return ValidationResult.invalid("File must be a PDF");
        }

        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            int pageCount = document.getNumberOfPages();
            if (pageCount == 0) {
                return ValidationResult.invalid("The PDF file contains no pages");
            }
            if (document.isEncrypted()) {
                return ValidationResult.invalid(ENCRYPTED_MESSAGE);
            }
            try {
                document.getPage(0).getMediaBox();
            } catch (RuntimeException e) {
                log.warn("First page of '{}' is unreadable.", file, e);
                return ValidationResult.invalid("The PDF file appears to be corrupted or damaged");
            }
            return ValidationResult.valid("PDF is valid", Map.of("num_pages", pageCount, "file_size", fileSize));
        } catch (InvalidPasswordException e) {
            return ValidationResult.invalid(ENCRYPTED_MESSAGE);
        } catch (IOException e) {
            log.info("Rejected '{}' as a malformed PDF: {}", file.getFileName(), e.getMessage());
            return ValidationResult.invalid(describeParseFailure(e));
        }
    }

    private long maxAllowedSize(final long availableRam) {
        WatermarkProcessingConfig.Validation validation = processingConfig.getValidation();
        long bySafetyMargin = (long) (availableRam * validation.getRamSafetyMargin());
        return Math.min(bySafetyMargin, validation.getAbsoluteMaxFileSize().toBytes());
    }

    private String describeParseFailure(final IOException e) {
        String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        if (message.contains("encrypt") || message.contains("password") || message.contains("decrypt")) {
            return ENCRYPTED_MESSAGE;
        }
        if (message.contains("eof") || message.contains("truncated")) {
            return "The PDF file is incomplete or corrupted";
        }
        return "The uploaded file is not a valid PDF or contains structural errors";
    }
}
