package com.eyelevel.watermarks.service.watermark;

import com.eyelevel.watermarks.model.WatermarkColor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The rendering capability applied to each chunk. Implementations read one chunk document and
 * write its transformed copy; they must be safe to call from several worker threads at once.
 */
public interface PageTransformer {

    /**
     * @param chunkPath  The chunk document to read.
     * @param outputPath Where the transformed document is written.
     * @param color      The visual parameter assigned to this chunk.
     * @throws IOException if the chunk cannot be read or the output cannot be written.
     */
    void transform(Path chunkPath, Path outputPath, WatermarkColor color) throws IOException;
}
