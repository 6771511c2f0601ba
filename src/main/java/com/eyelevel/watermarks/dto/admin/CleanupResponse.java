package com.eyelevel.watermarks.dto.admin;

public record CleanupResponse(String message, int removed) {
}
