package com.eyelevel.watermarks.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Watermark Service API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API watermarks PDF documents. An uploaded PDF is split into page chunks,
                                every chunk is stamped in its own color, and the chunks are merged back in order.

                                Key features include:
                                * **Admission Control:** Uploads are refused with a retry hint when disk or memory is short.
                                * **Fair Queueing:** Jobs start strictly in upload order, one at a time.
                                * **Status Polling:** Stage, progress, queue position and estimated wait per job.
                                * **Download Window:** Results are kept for a short window and reclaimed afterwards.
                                """));
    }
}
