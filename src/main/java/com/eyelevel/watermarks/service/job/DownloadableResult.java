package com.eyelevel.watermarks.service.job;

import java.nio.file.Path;

/**
 * A finished result ready to be streamed to the client.
 */
public record DownloadableResult(String jobId, Path path, String filename, long size) {
}
