package com.eyelevel.watermarks.controller;

import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.dto.admin.CleanupResponse;
import com.eyelevel.watermarks.dto.admin.JobListingResponse;
import com.eyelevel.watermarks.dto.common.ApiResponse;
import com.eyelevel.watermarks.dto.health.HealthResponse;
import com.eyelevel.watermarks.dto.health.ServiceInfoResponse;
import com.eyelevel.watermarks.dto.size.SizeCheckRequest;
import com.eyelevel.watermarks.dto.status.JobStatusResponse;
import com.eyelevel.watermarks.dto.upload.UploadResponse;
import com.eyelevel.watermarks.service.job.DownloadableResult;
import com.eyelevel.watermarks.service.job.JobOrchestrationService;
import com.eyelevel.watermarks.service.session.SessionIdentityService;
import com.eyelevel.watermarks.service.validation.SizeAllowance;
import com.eyelevel.watermarks.service.validation.UploadValidationService;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;

/**
 * REST controller for the watermarking workflow: size check, upload, status polling, download and
 * cleanup. JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class WatermarkJobController implements WatermarkJobApi {

    private static final Duration OWNER_COOKIE_MAX_AGE = Duration.ofDays(30);

    private final JobOrchestrationService orchestrationService;
    private final UploadValidationService validationService;
    private final SessionIdentityService sessionIdentityService;
    private final WatermarkProcessingConfig processingConfig;

    @Value("${spring.application.name:watermark-service}")
    private String serviceName;

    @Value("${app.version:1.0.0}")
    private String serviceVersion;

    @Override
    @GetMapping("/")
    public ResponseEntity<ApiResponse<ServiceInfoResponse>> serviceInfo() {
        return ok(new ServiceInfoResponse(serviceName, "online", serviceVersion), null);
    }

    @Override
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthResponse>> health() {
        return ok(orchestrationService.health(), null);
    }

    @Override
    @PostMapping("/api/check-size")
    public ResponseEntity<ApiResponse<SizeAllowance>> checkSize(@Valid @RequestBody final SizeCheckRequest request) {
        log.debug("Checking size allowance for {} bytes.", request.fileSize());
        SizeAllowance allowance = validationService.checkSizeAllowance(request.fileSize());
        return ok(allowance, allowance.message());
    }

    @Override
    @PostMapping(value = "/api/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<UploadResponse>> upload(
            @RequestParam("file") final MultipartFile file,
            @RequestParam(value = "chunk_size", required = false) final Integer chunkSize,
            @CookieValue(name = SessionIdentityService.OWNER_COOKIE, required = false) final String ownerId,
            final HttpServletResponse servletResponse) {

        String owner = sessionIdentityService.resolve(ownerId);
        if (!owner.equals(ownerId)) {
            issueOwnerCookie(owner, servletResponse);
        }
        int effectiveChunkSize = chunkSize != null ? chunkSize : processingConfig.getDefaultChunkSize();
        log.info("Received upload '{}' ({} bytes) with chunk size {}.", file.getOriginalFilename(), file.getSize(),
                 effectiveChunkSize);

        try (InputStream content = file.getInputStream()) {
            UploadResponse response = orchestrationService.submit(owner, file.getOriginalFilename(), file.getSize(),
                                                                  content, effectiveChunkSize);
            return ok(response, response.message());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read the uploaded file", e);
        }
    }

    @Override
    @GetMapping("/api/status/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getStatus(@PathVariable final String jobId) {
        return ok(orchestrationService.getStatus(jobId), null);
    }

    @Override
    @GetMapping("/api/download/{jobId}")
    public ResponseEntity<StreamingResponseBody> download(@PathVariable final String jobId) {
        DownloadableResult result = orchestrationService.prepareDownload(jobId);
        log.info("[JobId: {}] Streaming result ({} bytes).", jobId, result.size());

        StreamingResponseBody body = outputStream -> {
            try (InputStream in = Files.newInputStream(result.path())) {
                in.transferTo(outputStream);
            }
            outputStream.flush();
            orchestrationService.completeDownload(jobId);
        };
        return ResponseEntity.ok()
                             .contentType(MediaType.APPLICATION_PDF)
                             .contentLength(result.size())
                             .header(HttpHeaders.CONTENT_DISPOSITION,
                                     ContentDisposition.attachment().filename(result.filename()).build().toString())
                             .body(body);
    }

    @Override
    @DeleteMapping("/api/cleanup/{jobId}")
    public ResponseEntity<ApiResponse<CleanupResponse>> cleanup(@PathVariable final String jobId) {
        CleanupResponse response = orchestrationService.cleanup(jobId);
        return ok(response, response.message());
    }

    @Override
    @GetMapping("/api/admin/jobs")
    public ResponseEntity<ApiResponse<JobListingResponse>> listJobs() {
        return ok(orchestrationService.listJobs(), null);
    }

    @Override
    @PostMapping("/api/admin/cleanup-old")
    public ResponseEntity<ApiResponse<CleanupResponse>> cleanupOld() {
        CleanupResponse response = orchestrationService.pruneOldStatuses();
        return ok(response, response.message());
    }

    private void issueOwnerCookie(final String ownerId, final HttpServletResponse servletResponse) {
        ResponseCookie cookie = ResponseCookie.from(SessionIdentityService.OWNER_COOKIE, ownerId)
                                              .httpOnly(true)
                                              .sameSite("Lax")
                                              .path("/")
                                              .maxAge(OWNER_COOKIE_MAX_AGE)
                                              .build();
        servletResponse.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private static <T> ResponseEntity<ApiResponse<T>> ok(final T data, final String displayMessage) {
        ApiResponse<T> response = ApiResponse.<T>builder()
                                             .response(data)
                                             .displayMessage(displayMessage)
                                             .showMessage(displayMessage != null)
                                             .statusCode(HttpStatus.OK.value())
                                             .build();
        return ResponseEntity.ok(response);
    }
}
