package com.eyelevel.watermarks.dto.upload;

/**
 * Returned once an upload has been validated and queued.
 *
 * @param jobId                The identifier to poll and download with.
 * @param message              A message for the user.
 * @param queuePosition        1-based position among queued jobs.
 * @param estimatedWaitSeconds Heuristic wait before processing starts.
 */
public record UploadResponse(String jobId, String message, int queuePosition, long estimatedWaitSeconds) {
}
