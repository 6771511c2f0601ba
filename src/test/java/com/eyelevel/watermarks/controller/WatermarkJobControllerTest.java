package com.eyelevel.watermarks.controller;

import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.dto.admin.CleanupResponse;
import com.eyelevel.watermarks.dto.status.JobStatusResponse;
import com.eyelevel.watermarks.dto.upload.UploadResponse;
import com.eyelevel.watermarks.exception.DocumentValidationException;
import com.eyelevel.watermarks.exception.apiclient.AdmissionRejectedException;
import com.eyelevel.watermarks.exception.apiclient.ConflictException;
import com.eyelevel.watermarks.exception.apiclient.DownloadExpiredException;
import com.eyelevel.watermarks.exception.apiclient.NotFoundException;
import com.eyelevel.watermarks.exception.handler.GlobalExceptionHandler;
import com.eyelevel.watermarks.model.LifecycleState;
import com.eyelevel.watermarks.model.ProcessingStage;
import com.eyelevel.watermarks.service.job.DownloadableResult;
import com.eyelevel.watermarks.service.job.JobOrchestrationService;
import com.eyelevel.watermarks.service.queue.AdmissionRejectionReason;
import com.eyelevel.watermarks.service.session.SessionIdentityService;
import com.eyelevel.watermarks.service.validation.SizeAllowance;
import com.eyelevel.watermarks.service.validation.UploadValidationService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class WatermarkJobControllerTest {

    private static final String OWNER = "owner-0123456789abcdef";

    @Mock
    private JobOrchestrationService orchestrationService;
    @Mock
    private UploadValidationService validationService;

    @TempDir
    Path workDir;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        WatermarkJobController controller = new WatermarkJobController(orchestrationService, validationService,
                                                                       new SessionIdentityService(),
                                                                       new WatermarkProcessingConfig());
        ReflectionTestUtils.setField(controller, "serviceName", "watermark-service");
        ReflectionTestUtils.setField(controller, "serviceVersion", "1.0.0");
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                                 .setControllerAdvice(new GlobalExceptionHandler())
                                 .build();
    }

    private static MockMultipartFile pdfPart() {
        return new MockMultipartFile("file", "report.pdf", MediaType.APPLICATION_PDF_VALUE, "%PDF-1.7".getBytes());
    }

    @Test
    @DisplayName("reports the service as online")
    void serviceInfo() throws Exception {
        mockMvc.perform(get("/"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.status").value("online"))
               .andExpect(jsonPath("$.response.service").value("watermark-service"));
    }

    @Test
    @DisplayName("answers a size check for either spelling of the field")
    void checkSize() throws Exception {
        when(validationService.checkSizeAllowance(2048L))
                .thenReturn(new SizeAllowance(true, 1000000L, 2000000L, "File size is acceptable"));

        mockMvc.perform(post("/api/check-size").contentType(MediaType.APPLICATION_JSON).content("{\"file_size\": 2048}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.allowed").value(true))
               .andExpect(jsonPath("$.displayMessage").value("File size is acceptable"));
    }

    @Test
    @DisplayName("rejects a size check without a size")
    void checkSizeWithoutSize() throws Exception {
        mockMvc.perform(post("/api/check-size").contentType(MediaType.APPLICATION_JSON).content("{}"))
               .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("issues an owner cookie on the first upload and queues the job")
    void uploadIssuesCookie() throws Exception {
        when(orchestrationService.submit(anyString(), eq("report.pdf"), anyLong(), any(InputStream.class), eq(10)))
                .thenReturn(new UploadResponse("job-1", "File uploaded successfully. Waiting in queue.", 1, 120));

        mockMvc.perform(multipart("/api/upload").file(pdfPart()))
               .andExpect(status().isOk())
               .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("owner_id=")))
               .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")))
               .andExpect(jsonPath("$.response.jobId").value("job-1"))
               .andExpect(jsonPath("$.response.queuePosition").value(1));
    }

    @Test
    @DisplayName("keeps an existing owner cookie and forwards the chunk size")
    void uploadReusesOwner() throws Exception {
        when(orchestrationService.submit(eq(OWNER), eq("report.pdf"), anyLong(), any(InputStream.class), eq(4)))
                .thenReturn(new UploadResponse("job-2", "File uploaded successfully. Waiting in queue.", 2, 240));

        mockMvc.perform(multipart("/api/upload").file(pdfPart()).param("chunk_size", "4")
                                                .cookie(new Cookie("owner_id", OWNER)))
               .andExpect(status().isOk())
               .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
    }

    @Test
    @DisplayName("maps an invalid document to 400")
    void uploadInvalidDocument() throws Exception {
        when(orchestrationService.submit(anyString(), anyString(), anyLong(), any(InputStream.class), anyInt()))
                .thenThrow(new DocumentValidationException("The uploaded file is empty"));

        mockMvc.perform(multipart("/api/upload").file(pdfPart()))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("The uploaded file is empty"));
    }

    @Test
    @DisplayName("maps an admission rejection to 503 with Retry-After and the reason")
    void uploadRejected() throws Exception {
        when(orchestrationService.submit(anyString(), anyString(), anyLong(), any(InputStream.class), anyInt()))
                .thenThrow(new AdmissionRejectedException("Server memory insufficient. Please try again shortly.",
                                                          AdmissionRejectionReason.MEMORY, 60));

        mockMvc.perform(multipart("/api/upload").file(pdfPart()))
               .andExpect(status().isServiceUnavailable())
               .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
               .andExpect(jsonPath("$.response.reason").value("memory"))
               .andExpect(jsonPath("$.response.retryAfterSeconds").value(60));
    }

    @Test
    @DisplayName("returns the job status and maps unknown and expired jobs")
    void statusEndpoint() throws Exception {
        when(orchestrationService.getStatus("job-1")).thenReturn(JobStatusResponse.builder()
                                                                                  .jobId("job-1")
                                                                                  .status(ProcessingStage.MERGING)
                                                                                  .progress(87)
                                                                                  .lifecycleState(LifecycleState.PROCESSING)
                                                                                  .build());
        when(orchestrationService.getStatus("missing")).thenThrow(new NotFoundException("Job not found"));
        when(orchestrationService.getStatus("old")).thenThrow(new DownloadExpiredException("old"));

        mockMvc.perform(get("/api/status/job-1"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.status").value("merging"))
               .andExpect(jsonPath("$.response.progress").value(87))
               .andExpect(jsonPath("$.response.lifecycleState").value("processing"));
        mockMvc.perform(get("/api/status/missing")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/status/old")).andExpect(status().isGone());
    }

    @Test
    @DisplayName("streams the result and marks it downloaded afterwards")
    void download() throws Exception {
        Path result = Files.write(workDir.resolve("watermarked_job-1.pdf"), "%PDF-result".getBytes());
        when(orchestrationService.prepareDownload("job-1"))
                .thenReturn(new DownloadableResult("job-1", result, "watermarked_job-1.pdf", Files.size(result)));

        MvcResult started = mockMvc.perform(get("/api/download/job-1"))
                                   .andExpect(request().asyncStarted())
                                   .andReturn();
        mockMvc.perform(asyncDispatch(started))
               .andExpect(status().isOk())
               .andExpect(content().contentType(MediaType.APPLICATION_PDF))
               .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("watermarked_job-1.pdf")))
               .andExpect(content().string("%PDF-result"));

        verify(orchestrationService).completeDownload("job-1");
    }

    @Test
    @DisplayName("refuses to download an unfinished job")
    void downloadNotReady() throws Exception {
        when(orchestrationService.prepareDownload("job-1"))
                .thenThrow(new ConflictException("Job not ready. Current status: queued"));

        mockMvc.perform(get("/api/download/job-1"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.displayMessage").value("Job not ready. Current status: queued"));
        verify(orchestrationService, never()).completeDownload(anyString());
    }

    @Test
    @DisplayName("cleans up a job on request")
    void cleanup() throws Exception {
        when(orchestrationService.cleanup("job-1")).thenReturn(new CleanupResponse("Job job-1 cleaned up successfully", 1));

        mockMvc.perform(delete("/api/cleanup/job-1"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.removed").value(1));
    }
}
