package com.eyelevel.watermarks.service.watermark;

import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import com.eyelevel.watermarks.model.WatermarkColor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rotates through the configured colors so that neighbouring chunks are told apart, up to the
 * palette length.
 */
@Component
public class WatermarkPalette {

    private final List<WatermarkColor> colors;

    @Autowired
    public WatermarkPalette(final WatermarkProcessingConfig config) {
        this(config.getWatermark().getColors().stream().map(WatermarkColor::fromHex).toList());
    }

    public WatermarkPalette(final List<WatermarkColor> colors) {
        if (colors.isEmpty()) {
            throw new IllegalArgumentException("The watermark palette needs at least one color");
        }
        this.colors = List.copyOf(colors);
    }

    public WatermarkColor colorForChunk(final int chunkIndex) {
        return colors.get(Math.floorMod(chunkIndex, colors.size()));
    }

    public int size() {
        return colors.size();
    }
}
