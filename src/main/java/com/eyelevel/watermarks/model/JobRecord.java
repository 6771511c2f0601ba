package com.eyelevel.watermarks.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The authoritative lifecycle record of a watermarking job, owned exclusively by the job queue
 * and persisted in the ledger snapshot with snake_case keys and ISO-8601 timestamps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobRecord {

    private String jobId;

    /**
     * The session that submitted the job. A session may own several jobs.
     */
    private String ownerId;

    private String sourcePath;
    private long declaredSize;
    private int chunkSize;
    private LifecycleState lifecycleState;

    private Instant queuedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant downloadedAt;

    /**
     * Set only while the job is {@link LifecycleState#FINISHED}.
     */
    private Instant downloadWindowExpires;

    private String lastError;

    /**
     * @return A detached copy that callers may read without holding the queue lock.
     */
    public JobRecord copy() {
        return toBuilder().build();
    }
}
