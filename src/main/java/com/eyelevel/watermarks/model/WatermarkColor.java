package com.eyelevel.watermarks.model;

import java.util.Locale;

/**
 * An RGB watermark color with components in {@code [0, 1]}.
 *
 * @param red   The red component.
 * @param green The green component.
 * @param blue  The blue component.
 */
public record WatermarkColor(float red, float green, float blue) {

    public WatermarkColor {
        if (!inRange(red) || !inRange(green) || !inRange(blue)) {
            throw new IllegalArgumentException("Color components must be within [0, 1]");
        }
    }

    /**
     * Parses a {@code #RRGGBB} value.
     *
     * @param hex The hex string, with or without the leading '#'.
     * @return The parsed color.
     */
    public static WatermarkColor fromHex(final String hex) {
        String value = hex.trim();
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        if (value.length() != 6) {
            throw new IllegalArgumentException("Expected a #RRGGBB color but got '" + hex + "'");
        }
        int rgb = Integer.parseInt(value, 16);
        return new WatermarkColor(((rgb >> 16) & 0xFF) / 255f, ((rgb >> 8) & 0xFF) / 255f, (rgb & 0xFF) / 255f);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", Math.round(red * 255), Math.round(green * 255),
                             Math.round(blue * 255));
    }

    private static boolean inRange(final float component) {
        return component >= 0f && component <= 1f;
    }
}
