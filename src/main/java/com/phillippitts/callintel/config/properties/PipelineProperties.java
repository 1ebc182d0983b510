package com.phillippitts.callintel.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the call-processing pipeline.
 * Binds to properties prefixed with "pipeline".
 *
 * <p>Example application.properties:
 * <pre>
 * pipeline.recording-poll-interval-ms=2000
 * pipeline.recording-wait-timeout-ms=60000
 * pipeline.transcription-max-attempts=6
 * pipeline.transcription-base-delay-ms=2000
 * pipeline.transcription-max-delay-ms=20000
 * pipeline.transcription-attempt-timeout-ms=120000
 * pipeline.prior-call-limit=5
 * pipeline.stuck-threshold-minutes=15
 * </pre>
 *
 * @param recordingPollIntervalMs       how often to re-read a call whose recording URL is missing
 * @param recordingWaitTimeoutMs        how long to wait for the recording webhook before failing
 * @param transcriptionMaxAttempts      total speech-to-text attempts while the recording is not downloadable
 * @param transcriptionBaseDelayMs      first backoff delay between speech-to-text attempts
 * @param transcriptionMaxDelayMs       cap for speech-to-text backoff delays
 * @param transcriptionAttemptTimeoutMs bound for a single download-and-transcribe attempt
 * @param priorCallLimit                prior calls fed into the complete analysis
 * @param stuckThresholdMinutes         age after which a record still in processing is reported
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
        @DefaultValue("2000")
        @Positive(message = "Recording poll interval must be positive")
        long recordingPollIntervalMs,

        @DefaultValue("60000")
        @Positive(message = "Recording wait timeout must be positive")
        long recordingWaitTimeoutMs,

        @DefaultValue("6")
        @Min(value = 1, message = "Transcription attempts must be at least 1")
        int transcriptionMaxAttempts,

        @DefaultValue("2000")
        @Positive(message = "Transcription base delay must be positive")
        long transcriptionBaseDelayMs,

        @DefaultValue("20000")
        @Positive(message = "Transcription max delay must be positive")
        long transcriptionMaxDelayMs,

        @DefaultValue("120000")
        @Positive(message = "Transcription attempt timeout must be positive")
        long transcriptionAttemptTimeoutMs,

        @DefaultValue("5")
        @Min(value = 1, message = "Prior call limit must be at least 1")
        @Max(value = 50, message = "Prior call limit must be at most 50")
        int priorCallLimit,

        @DefaultValue("15")
        @Positive(message = "Stuck threshold must be positive")
        long stuckThresholdMinutes
) {

    public Duration recordingPollInterval() {
        return Duration.ofMillis(recordingPollIntervalMs);
    }

    public Duration recordingWaitTimeout() {
        return Duration.ofMillis(recordingWaitTimeoutMs);
    }

    public Duration transcriptionAttemptTimeout() {
        return Duration.ofMillis(transcriptionAttemptTimeoutMs);
    }

    public Duration stuckThreshold() {
        return Duration.ofMinutes(stuckThresholdMinutes);
    }
}
