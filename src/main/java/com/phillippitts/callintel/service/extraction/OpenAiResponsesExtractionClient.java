package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.exception.ConfigurationException;
import com.phillippitts.callintel.exception.ErrorCategory;
import com.phillippitts.callintel.exception.MalformedResponseException;
import com.phillippitts.callintel.exception.PromptNotFoundException;
import com.phillippitts.callintel.exception.UpstreamException;
import com.phillippitts.callintel.service.events.ExtractionFailureEvent;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.service.retry.ClassifiedFailure;
import com.phillippitts.callintel.service.retry.RetryConfig;
import com.phillippitts.callintel.service.retry.RetryExecutor;
import com.phillippitts.callintel.service.retry.RetryResult;
import com.phillippitts.callintel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * {@link StructuredExtractionClient} backed by the OpenAI Responses API with stored prompt
 * templates.
 *
 * <p>Request flow:
 * <ol>
 *   <li>Send {@code {prompt: {id}, input: [user turn]}} through {@link RetryExecutor}; 429, 500,
 *       503 and timeouts are retried with exponential backoff, anything else stops at once.</li>
 *   <li>If the template id is unknown to the API credential, resend the same input once
 *       without a template against the configured fallback model, prefixed with a system turn
 *       that demands raw JSON. Without a fallback model this is a {@link ConfigurationException}.</li>
 *   <li>Parse the message output with {@link ResponsesOutputParser}.</li>
 * </ol>
 *
 * <p>Final failures and parse failures publish an {@link ExtractionFailureEvent}; recovered
 * attempts do not.
 */
public class OpenAiResponsesExtractionClient implements StructuredExtractionClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiResponsesExtractionClient.class);

    static final String RAW_JSON_INSTRUCTION =
            "Return ONLY valid JSON. Do not include markdown, code fences, or commentary. "
                    + "If a field is unknown, use null. Ensure the JSON matches the expected schema.";

    static final String OPERATION = "extraction";

    private final ResponsesApiTransport transport;
    private final ExtractionPromptBuilder promptBuilder;
    private final RetryExecutor retryExecutor;
    private final RetryConfig retryConfig;
    private final String fallbackModel;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public OpenAiResponsesExtractionClient(ResponsesApiTransport transport,
                                           ExtractionPromptBuilder promptBuilder,
                                           RetryExecutor retryExecutor,
                                           RetryConfig retryConfig,
                                           String fallbackModel,
                                           ApplicationEventPublisher publisher,
                                           PipelineMetrics metrics,
                                           Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig must not be null");
        this.fallbackModel = fallbackModel == null || fallbackModel.isBlank() ? null : fallbackModel.trim();
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JSONObject extract(String promptId, String transcript, ExtractionHistory history) {
        Objects.requireNonNull(promptId, "promptId must not be null");
        Objects.requireNonNull(transcript, "transcript must not be null");
        String operation = history == null ? "individual" : "complete";

        String userTurn = history == null
                ? promptBuilder.individualPrompt(transcript)
                : promptBuilder.completePrompt(transcript, history);
        JSONArray input = new JSONArray().put(turn("user", userTurn));
        JSONObject request = new JSONObject()
                .put("prompt", new JSONObject().put("id", promptId))
                .put("input", input);

        LOG.info("Requesting {} analysis (prompt={}, transcript={} chars)",
                operation, LogSanitizer.truncate(promptId, 20), transcript.length());

        RetryResult<JSONObject> result = retryExecutor.executeWithRetry(
                () -> transport.createResponse(request), retryConfig, "Responses API " + operation);
        metrics.recordAttempts(OPERATION, result.attempts());

        JSONObject response;
        if (result.success()) {
            response = result.value();
        } else if (result.error() instanceof PromptNotFoundException notFound) {
            response = callFallbackModel(notFound, input, operation);
        } else {
            publishFailure(ExtractionFailureEvent.API_FAILURE, operation, result.error(), result.attempts());
            throw asUpstream(result.error());
        }

        return parse(response, operation);
    }

    private JSONObject callFallbackModel(PromptNotFoundException notFound, JSONArray input, String operation) {
        if (fallbackModel == null) {
            throw new ConfigurationException("extraction.openai.fallback-model",
                    "Prompt template not found (" + notFound.getPromptId() + "). Configure valid prompt ids "
                            + "(system defaults or user overrides), or set a fallback model to enable the fallback");
        }
        LOG.warn("Prompt template {} not found; falling back to model {}", notFound.getPromptId(), fallbackModel);

        JSONArray fallbackInput = new JSONArray().put(turn("system", RAW_JSON_INSTRUCTION));
        for (int i = 0; i < input.length(); i++) {
            fallbackInput.put(input.get(i));
        }
        JSONObject request = new JSONObject()
                .put("model", fallbackModel)
                .put("input", fallbackInput);

        try {
            return transport.createResponse(request);
        } catch (RuntimeException e) {
            publishFailure(ExtractionFailureEvent.API_FAILURE, operation + "_fallback", e, 1);
            throw e;
        }
    }

    private JSONObject parse(JSONObject response, String operation) {
        try {
            JSONObject parsed = ResponsesOutputParser.parse(response);
            LOG.info("{} analysis received (response={})", operation, response.optString("id", "n/a"));
            return parsed;
        } catch (MalformedResponseException e) {
            LOG.error("Could not parse {} analysis (response={}): {}", operation, e.getResponseId(), e.getMessage());
            publishFailure(ExtractionFailureEvent.PARSE_FAILURE, operation, e, 1);
            throw e;
        }
    }

    private void publishFailure(String errorType, String operation, Throwable error, int attempts) {
        int status = error instanceof UpstreamException upstream ? upstream.getStatusCode() : 0;
        String code = error instanceof ClassifiedFailure classified ? classified.getErrorCode() : null;
        String message = error == null ? "unknown error" : String.valueOf(error.getMessage());
        publisher.publishEvent(new ExtractionFailureEvent(errorType, operation, status, code, attempts,
                message, clock.instant()));
    }

    private static RuntimeException asUpstream(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        return new UpstreamException("Responses API call failed: " + (error == null ? "unknown error" : error.getMessage()),
                "openai", 0, null, ErrorCategory.PERMANENT_UPSTREAM, error);
    }

    private static JSONObject turn(String role, String content) {
        return new JSONObject().put("role", role).put("content", content);
    }
}
