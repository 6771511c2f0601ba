package com.eyelevel.watermarks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Binds application properties under the "app.queue" prefix: ledger location, admission
 * resource math, post-completion lifecycle windows and the container memory probes.
 */
@Data
@ConfigurationProperties(prefix = "app.queue")
public class JobQueueConfig {

    private String ledgerFile = "temp_files/queue.json";
    private Admission admission = new Admission();
    private Lifecycle lifecycle = new Lifecycle();
    private Estimation estimation = new Estimation();
    private Memory memory = new Memory();

    @Data
    public static class Admission {
        /**
         * Fixed headroom required on top of twice the declared upload size.
         */
        private DataSize diskSafetyBuffer = DataSize.ofMegabytes(150);
        private DataSize minFreeRam = DataSize.ofMegabytes(100);
        private double ramMultiplier = 2.5;
        private double diskMultiplier = 3.0;
        private DataSize ramBuffer = DataSize.ofMegabytes(300);
        private DataSize diskBuffer = DataSize.ofMegabytes(150);
    }

    @Data
    public static class Lifecycle {
        private Duration downloadWindow = Duration.ofMinutes(1);
        private Duration errorRetention = Duration.ofHours(1);
        private Duration statusRetention = Duration.ofHours(1);
    }

    @Data
    public static class Estimation {
        private int averageWindow = 10;
        private long defaultProcessingSeconds = 120;
        private long idleDiskRetrySeconds = 300;
        private long idleMemoryRetrySeconds = 60;
    }

    @Data
    public static class Memory {
        /**
         * Used when no cgroup limit is visible. Unset means unconstrained.
         */
        private DataSize limitOverride;
        private String cgroupV2MemoryMax = "/sys/fs/cgroup/memory.max";
        private String cgroupV1MemoryLimit = "/sys/fs/cgroup/memory/memory.limit_in_bytes";
        private String procSelfStatus = "/proc/self/status";
    }
}
