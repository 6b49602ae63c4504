package com.eyelevel.uploadqueue.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

/**
 * Swagger UI and OpenAPI document for the upload queue endpoints. Disabled in production.
 */
@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;
    private final UploadQueueProperties uploadQueueProperties;

    @Bean
    public GroupedOpenApi uploadQueueApiGroup() {
        return GroupedOpenApi.builder()
                .group("upload-queue")
                .pathsToMatch("/uploads/**")
                .build();
    }

    @Bean
    public OpenAPI uploadQueueOpenAPI() {
        final String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");

        return new OpenAPI()
                .info(new Info().title("Upload Queue API")
                        .version(version)
                        .description(String.format("""
                                Queues local files and remote references for the ingestion service and follows
                                each one until the service reports a final result.

                                * Up to %d uploads transfer at the same time; the rest wait in the order they were queued.
                                * Accepted uploads are polled every %s and failed after %s without a final result.
                                * Failed uploads can be retried, unfinished ones cancelled.
                                * Completions and failures are streamed from `/uploads/v1/events`.
                                """,
                                uploadQueueProperties.getMaxConcurrent(),
                                uploadQueueProperties.getPollInterval(),
                                uploadQueueProperties.getPollTimeout()))
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")))
                .addTagsItem(new Tag().name("Upload Queue").description("Queueing, inspection and lifecycle of uploads"));
    }
}
