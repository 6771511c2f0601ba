package com.eyelevel.watermarks.service.validation;

import java.util.Map;

/**
 * Outcome of an upload check. {@code metadata} carries facts learned while validating, such as the
 * page count.
 */
public record ValidationResult(boolean valid, String message, Map<String, Object> metadata) {

    public static ValidationResult valid(final String message) {
        return new ValidationResult(true, message, Map.of());
    }

    public static ValidationResult valid(final String message, final Map<String, Object> metadata) {
        return new ValidationResult(true, message, metadata);
    }

    public static ValidationResult invalid(final String message) {
        return new ValidationResult(false, message, Map.of());
    }
}
