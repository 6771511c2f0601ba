package com.eyelevel.watermarks.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Describes one contiguous page range of a document while it moves through a single pipeline run.
 * A chunk is mutated only by the worker that watermarks it.
 */
@Data
@Builder
public class ChunkInfo {

    private final int chunkId;

    /**
     * Position of this chunk in the merged result.
     */
    private final int order;

    /**
     * First page of the range, inclusive and zero-based.
     */
    private final int startPage;

    /**
     * End of the range, exclusive.
     */
    private final int endPage;

    private final Path inputPath;
    private final WatermarkColor color;

    private Path outputPath;

    @Builder.Default
    private ChunkStatus status = ChunkStatus.PENDING;

    private String error;

    public int pageCount() {
        return endPage - startPage;
    }
}
