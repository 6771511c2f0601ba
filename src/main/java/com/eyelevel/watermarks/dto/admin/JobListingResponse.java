package com.eyelevel.watermarks.dto.admin;

import com.eyelevel.watermarks.model.JobRecord;
import com.eyelevel.watermarks.model.JobStatus;

import java.util.Map;

/**
 * Admin view of every tracked status and every ledger record.
 */
public record JobListingResponse(int totalJobs, int activeJobs, Map<String, JobStatus> jobs,
                                 Map<String, JobRecord> ledger) {
}
