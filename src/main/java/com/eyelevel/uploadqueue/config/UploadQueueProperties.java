package com.eyelevel.uploadqueue.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds application properties under the "app.upload-queue" prefix. Defaults match the values the
 * upload screen has always used: three parallel transfers, a poll every five seconds, five minutes
 * before a stuck upload is failed.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.upload-queue")
public class UploadQueueProperties {

    public static final int DEFAULT_MAX_CONCURRENT = 3;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMinutes(5);

    /**
     * Maximum number of uploads transferring at the same time.
     */
    @Min(1)
    private int maxConcurrent = DEFAULT_MAX_CONCURRENT;

    /**
     * Delay between two status queries for an upload being processed.
     */
    @NotNull
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /**
     * How long an upload may stay in processing before it is failed.
     */
    @NotNull
    private Duration pollTimeout = DEFAULT_POLL_TIMEOUT;

    /**
     * Period of the safety sweep that re-runs admission for pending uploads.
     */
    @NotNull
    private Duration admissionSweepInterval = Duration.ofSeconds(10);

    /**
     * Nominal number of poll cycles inside the timeout window. Informational only: the deadline is
     * enforced on elapsed time.
     */
    public long maxAttempts() {
        return pollTimeout.toMillis() / pollInterval.toMillis();
    }

    @AssertTrue(message = "poll-interval and poll-timeout must be positive durations")
    public boolean isPollWindowValid() {
        return pollInterval != null && pollTimeout != null
                && !pollInterval.isNegative() && !pollInterval.isZero()
                && !pollTimeout.isNegative() && !pollTimeout.isZero();
    }
}
