package com.eyelevel.watermarks.dto.size;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;

/**
 * Pre-upload size check request. Accepts both {@code fileSize} and {@code file_size}.
 */
public record SizeCheckRequest(
        @JsonAlias("file_size")
        @NotNull(message = "The 'fileSize' field is required.")
        Long fileSize) {
}
