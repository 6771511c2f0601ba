package com.eyelevel.watermarks;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.config.WatermarkProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Watermark Service Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.processing" and "app.queue" properties to
 *     {@link WatermarkProcessingConfig} and {@link JobQueueConfig}.</li>
 *     <li>{@link EnableScheduling}: activates the queue dispatch loop and the expiry sweep.</li>
 *     <li>{@link EnableRetry}: retries transient ledger snapshot writes.</li>
 * </ul>
 */
@Slf4j
@EnableRetry
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = {WatermarkProcessingConfig.class, JobQueueConfig.class})
public class WatermarkServiceApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting WatermarkServiceApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(WatermarkServiceApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "WatermarkService"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8000"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
