package com.eyelevel.uploadqueue;

import com.eyelevel.uploadqueue.config.UploadQueueProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Upload Queue Spring Boot application.
 * <p>
 * {@link EnableScheduling} activates the periodic admission sweep; {@link EnableConfigurationProperties}
 * binds the "app.upload-queue" properties to {@link UploadQueueProperties}.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = UploadQueueProperties.class)
public class UploadQueueApplication {

    public static void main(final String[] args) {
        log.info("Starting UploadQueueApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(UploadQueueApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "UploadQueue"));
        log.info("  - Local:       http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Ingestion:   {}", env.getProperty("app.ingestion-client.baseurl"));
        log.info("  - Concurrency: {} transfer(s)", env.getProperty("app.upload-queue.max-concurrent"));
        log.info("  - Profile(s):  {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
