package com.phillippitts.callintel.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the structured-extraction (reasoning) service.
 * Binds to properties prefixed with "extraction.openai".
 *
 * <p>Example application.properties:
 * <pre>
 * extraction.openai.api-key=${OPENAI_API_KEY}
 * extraction.openai.base-url=https://api.openai.com/v1
 * extraction.openai.timeout-ms=30000
 * extraction.openai.individual-prompt-id=${OPENAI_INDIVIDUAL_PROMPT_ID:}
 * extraction.openai.complete-prompt-id=${OPENAI_COMPLETE_PROMPT_ID:}
 * extraction.openai.fallback-model=${OPENAI_MODEL:}
 * extraction.openai.max-retries=3
 * extraction.openai.retry-delay-ms=1000
 * extraction.openai.prompt-timezone=UTC
 * </pre>
 *
 * @param apiKey             bearer credential
 * @param baseUrl            API root, without trailing slash
 * @param timeoutMs          per-request read timeout
 * @param individualPromptId system default template for individual analyses
 * @param completePromptId   system default template for complete analyses
 * @param fallbackModel      model used when a template id is unknown; blank disables the fallback
 * @param maxRetries         retries for transient failures (429, 500, 503, timeout)
 * @param retryDelayMs       first backoff delay, doubled per retry
 * @param promptTimezone     zone used for the "current date and time" line in prompts
 */
@ConfigurationProperties(prefix = "extraction.openai")
@Validated
public record ExtractionProperties(
        @NotBlank(message = "OpenAI API key must not be blank")
        String apiKey,

        @DefaultValue("https://api.openai.com/v1")
        @NotBlank(message = "OpenAI base URL must not be blank")
        String baseUrl,

        @DefaultValue("30000")
        @Positive(message = "Timeout must be positive")
        long timeoutMs,

        String individualPromptId,

        String completePromptId,

        String fallbackModel,

        @DefaultValue("3")
        @Min(value = 0, message = "Max retries must not be negative")
        @Max(value = 10, message = "Max retries must not exceed 10")
        int maxRetries,

        @DefaultValue("1000")
        @Positive(message = "Retry delay must be positive")
        long retryDelayMs,

        @DefaultValue("UTC")
        @NotBlank(message = "Prompt timezone must not be blank")
        String promptTimezone
) {

    public boolean hasFallbackModel() {
        return fallbackModel != null && !fallbackModel.isBlank();
    }
}
