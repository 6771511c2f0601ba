package com.eyelevel.watermarks.service.pipeline;

import com.eyelevel.watermarks.model.PageRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a document into contiguous, non-overlapping page ranges.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    /**
     * Splits {@code [0, pageCount)} into ranges of {@code min(requestedChunkSize, pageCount)} pages;
     * the last range may be shorter.
     *
     * @param pageCount          Total pages in the document.
     * @param requestedChunkSize Pages per chunk requested by the client, must be positive.
     * @return {@code ceil(pageCount / chunkSize)} ranges in document order, empty for an empty document.
     */
    public static List<PageRange> plan(final int pageCount, final int requestedChunkSize) {
        if (requestedChunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be greater than 0");
        }
        if (pageCount < 0) {
            throw new IllegalArgumentException("Page count cannot be negative");
        }
        List<PageRange> ranges = new ArrayList<>();
        if (pageCount == 0) {
            return ranges;
        }
        int effectiveChunkSize = Math.min(requestedChunkSize, pageCount);
        for (int start = 0; start < pageCount; start += effectiveChunkSize) {
            ranges.add(new PageRange(start, Math.min(start + effectiveChunkSize, pageCount)));
        }
        return ranges;
    }
}
