package com.eyelevel.watermarks.service.validation;

/**
 * Answer to a pre-upload size check.
 *
 * @param allowed        Whether an upload of the requested size would be accepted right now.
 * @param maxAllowedSize The current upper bound in bytes.
 * @param availableRam   Memory available to the service in bytes.
 * @param message        A message for the user.
 */
public record SizeAllowance(boolean allowed, long maxAllowedSize, long availableRam, String message) {
}
