package com.eyelevel.watermarks.dto.health;

import java.util.Map;

/**
 * @param status     Always {@code healthy} while the service answers.
 * @param activeJobs Jobs whose status is in a non-terminal stage.
 * @param queue      Ledger record counts keyed by lifecycle state.
 */
public record HealthResponse(String status, int activeJobs, Map<String, Long> queue) {
}
