package com.eyelevel.watermarks.controller;

import com.eyelevel.watermarks.dto.admin.CleanupResponse;
import com.eyelevel.watermarks.dto.admin.JobListingResponse;
import com.eyelevel.watermarks.dto.common.ApiResponse;
import com.eyelevel.watermarks.dto.health.HealthResponse;
import com.eyelevel.watermarks.dto.health.ServiceInfoResponse;
import com.eyelevel.watermarks.dto.size.SizeCheckRequest;
import com.eyelevel.watermarks.dto.status.JobStatusResponse;
import com.eyelevel.watermarks.dto.upload.UploadResponse;
import com.eyelevel.watermarks.service.validation.SizeAllowance;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@Tag(name = "PDF Watermarking", description = "Endpoints for submitting PDFs, polling their progress and downloading the watermarked result.")
public interface WatermarkJobApi {

    @Operation(summary = "Service Banner", description = "Returns the service name, status and version.")
    ResponseEntity<ApiResponse<ServiceInfoResponse>> serviceInfo();

    @Operation(summary = "Health Check", description = "Reports the number of active jobs and ledger counts per lifecycle state.")
    ResponseEntity<ApiResponse<HealthResponse>> health();

    @Operation(summary = "Check Upload Size",
            description = "Pre-upload check. Tells the client whether a file of the given size would currently be accepted and what the limit is.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Size evaluated.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Allowed", value = """
                                    {
                                        "displayMessage": "File size is acceptable",
                                        "response": {
                                            "allowed": true,
                                            "maxAllowedSize": 524288000,
                                            "availableRam": 2147483648,
                                            "message": "File size is acceptable"
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing file size.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SizeAllowance>> checkSize(@Valid @RequestBody SizeCheckRequest request);

    @Operation(summary = "Upload PDF",
            description = "Validates and queues a PDF for watermarking. The job starts once it reaches the head of the queue and the server has room for it.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Upload accepted and queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Queued", value = """
                                    {
                                        "displayMessage": "File uploaded successfully. Waiting in queue.",
                                        "response": {
                                            "jobId": "1f0c4b8e-4f7e-4d1a-9a55-0d3c2f1b7e21",
                                            "message": "File uploaded successfully. Waiting in queue.",
                                            "queuePosition": 1,
                                            "estimatedWaitSeconds": 120
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Not a PDF, invalid chunk size, or an empty, encrypted or corrupt document.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "413", description = "Payload Too Large - The file exceeds the current server capacity.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service Unavailable - Not enough disk or memory right now. See the Retry-After header.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadResponse>> upload(
            @Parameter(description = "The PDF to watermark.", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Pages per chunk.", example = "10")
            @RequestParam(value = "chunk_size", required = false) Integer chunkSize,
            @Parameter(hidden = true) String ownerId,
            @Parameter(hidden = true) HttpServletResponse servletResponse);

    @Operation(summary = "Get Job Status", description = "Returns the stage, progress, queue position and estimated wait of a job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "410", description = "Gone - The download window has expired.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> getStatus(
            @Parameter(description = "The job identifier.", required = true) @PathVariable String jobId);

    @Operation(summary = "Download Result", description = "Streams the watermarked PDF. The job is reclaimed shortly after a successful download.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The watermarked PDF.",
                    content = @Content(mediaType = "application/pdf")),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown job or missing result.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job has not finished yet.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "410", description = "Gone - The download window has expired or the result was already downloaded.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<StreamingResponseBody> download(
            @Parameter(description = "The job identifier.", required = true) @PathVariable String jobId);

    @Operation(summary = "Clean Up Job", description = "Deletes a job's files, ledger entry and status.")
    ResponseEntity<ApiResponse<CleanupResponse>> cleanup(
            @Parameter(description = "The job identifier.", required = true) @PathVariable String jobId);

    @Operation(summary = "List Jobs (Admin)", description = "Returns every status record and the full ledger snapshot.")
    ResponseEntity<ApiResponse<JobListingResponse>> listJobs();

    @Operation(summary = "Prune Old Statuses (Admin)", description = "Removes status records older than the retention period.")
    ResponseEntity<ApiResponse<CleanupResponse>> cleanupOld();
}
