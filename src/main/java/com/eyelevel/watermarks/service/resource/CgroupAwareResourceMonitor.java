package com.eyelevel.watermarks.service.resource;

import com.eyelevel.watermarks.config.JobQueueConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A {@link ResourceMonitor} that respects container memory limits.
 * <p>
 * Inside a cgroup the host-wide free memory figure is misleadingly large, so when a ceiling is
 * enforced the available memory is {@code ceiling - residentSetSize}, clamped at zero. The ceiling is
 * looked up, in order, from cgroup v2 {@code memory.max}, cgroup v1 {@code memory.limit_in_bytes} and
 * the configured override. Without any of them the operating system's free physical memory is used.
 * Limits are re-read on every call because they may change while the process runs.
 */
@Slf4j
@Component
public class CgroupAwareResourceMonitor implements ResourceMonitor {

    /**
     * cgroup v1 reports "no limit" as a page-aligned value close to {@code Long.MAX_VALUE}.
     */
    private static final long CGROUP_V1_UNLIMITED_THRESHOLD = 1L << 60;

    private final JobQueueConfig.Memory memoryConfig;

    public CgroupAwareResourceMonitor(final JobQueueConfig config) {
        this.memoryConfig = config.getMemory();
    }

    @Override
    public long availableMemoryBytes() {
        OptionalLong ceiling = memoryCeilingBytes();
        if (ceiling.isPresent()) {
            long available = ceiling.getAsLong() - processResidentBytes();
            return Math.max(0L, available);
        }
        return systemFreeMemoryBytes();
    }

    @Override
    public long freeDiskBytes(final Path path) {
        Path probe = path.toAbsolutePath();
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        if (probe == null) {
            throw new UncheckedIOException(new IOException("No existing ancestor for " + path));
        }
        try {
            return Files.getFileStore(probe).getUsableSpace();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to inspect the volume holding " + probe, e);
        }
    }

    /**
     * Resolves the enforced memory ceiling, if any.
     *
     * @return The ceiling in bytes, or empty when the process is unconstrained.
     */
    public OptionalLong memoryCeilingBytes() {
        OptionalLong v2 = readCgroupV2Limit();
        if (v2.isPresent()) {
            return v2;
        }
        OptionalLong v1 = readCgroupV1Limit();
        if (v1.isPresent()) {
            return v1;
        }
        if (memoryConfig.getLimitOverride() != null) {
            return OptionalLong.of(memoryConfig.getLimitOverride().toBytes());
        }
        return OptionalLong.empty();
    }

    /**
     * @return The resident set size of this process from {@code /proc/self/status}, or the JVM's used
     * heap where that file is unavailable.
     */
    public long processResidentBytes() {
        Path status = Path.of(memoryConfig.getProcSelfStatus());
        if (Files.isReadable(status)) {
            try {
                List<String> lines = Files.readAllLines(status, StandardCharsets.UTF_8);
                for (String line : lines) {
                    if (line.startsWith("VmRSS:")) {
                        String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                        return Long.parseLong(parts[0]) * 1024L;
                    }
                }
            } catch (IOException | NumberFormatException e) {
                log.warn("Unable to read resident set size from {}. Falling back to JVM heap usage.", status, e);
            }
        }
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    private OptionalLong readCgroupV2Limit() {
        return readLimitFile(Path.of(memoryConfig.getCgroupV2MemoryMax()))
                .filter(value -> !"max".equals(value))
                .map(CgroupAwareResourceMonitor::parseLimit)
                .orElse(OptionalLong.empty());
    }

    private OptionalLong readCgroupV1Limit() {
        return readLimitFile(Path.of(memoryConfig.getCgroupV1MemoryLimit()))
                .map(CgroupAwareResourceMonitor::parseLimit)
                .orElse(OptionalLong.empty())
                .stream()
                .filter(limit -> limit < CGROUP_V1_UNLIMITED_THRESHOLD)
                .findFirst();
    }

    private Optional<String> readLimitFile(final Path file) {
        if (!Files.isReadable(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            log.warn("Unable to read memory limit file {}. Treating it as absent.", file, e);
            return Optional.empty();
        }
    }

    private static OptionalLong parseLimit(final String value) {
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable memory limit value '{}'.", value);
            return OptionalLong.empty();
        }
    }

    private long systemFreeMemoryBytes() {
        OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
        if (osBean instanceof com.sun.management.OperatingSystemMXBean platformBean) {
            return platformBean.getFreeMemorySize();
        }
        Runtime runtime = Runtime.getRuntime();
        return runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
    }
}
