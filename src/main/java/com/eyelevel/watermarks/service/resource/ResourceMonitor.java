package com.eyelevel.watermarks.service.resource;

import java.nio.file.Path;

/**
 * Reports the memory and disk headroom that admission control and dequeueing decisions use.
 */
public interface ResourceMonitor {

    /**
     * @return Bytes of memory this process may still use, never negative.
     */
    long availableMemoryBytes();

    /**
     * @param path A file or directory on the volume to inspect. It does not need to exist yet.
     * @return Usable bytes on that volume.
     * @throws java.io.UncheckedIOException if the volume cannot be inspected.
     */
    long freeDiskBytes(Path path);
}
