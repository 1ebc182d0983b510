package com.phillippitts.callintel.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech-to-text service and recording downloads.
 * Binds to properties prefixed with "stt".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.api-key=${OPENAI_API_KEY}
 * stt.base-url=https://api.openai.com/v1
 * stt.model=whisper-1
 * stt.timeout-ms=90000
 * stt.recording-username=${PLIVO_AUTH_ID:}
 * stt.recording-password=${PLIVO_AUTH_TOKEN:}
 * </pre>
 *
 * @param apiKey            bearer credential for the transcription endpoint
 * @param baseUrl           API root, without trailing slash
 * @param model             transcription model name
 * @param timeoutMs         read timeout for download and transcription requests
 * @param recordingUsername optional basic-auth user for recording downloads
 * @param recordingPassword optional basic-auth password for recording downloads
 */
@ConfigurationProperties(prefix = "stt")
@Validated
public record SpeechToTextProperties(
        @NotBlank(message = "Speech-to-text API key must not be blank")
        String apiKey,

        @DefaultValue("https://api.openai.com/v1")
        @NotBlank(message = "Speech-to-text base URL must not be blank")
        String baseUrl,

        @DefaultValue("whisper-1")
        @NotBlank(message = "Speech-to-text model must not be blank")
        String model,

        @DefaultValue("90000")
        @Positive(message = "Timeout must be positive")
        long timeoutMs,

        String recordingUsername,

        String recordingPassword
) {

    public boolean hasRecordingCredentials() {
        return recordingUsername != null && !recordingUsername.isBlank()
                && recordingPassword != null && !recordingPassword.isBlank();
    }
}
