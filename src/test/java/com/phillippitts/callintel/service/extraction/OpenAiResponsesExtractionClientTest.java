package com.phillippitts.callintel.service.extraction;

import com.phillippitts.callintel.exception.ConfigurationException;
import com.phillippitts.callintel.exception.MalformedResponseException;
import com.phillippitts.callintel.exception.PromptNotFoundException;
import com.phillippitts.callintel.exception.UpstreamException;
import com.phillippitts.callintel.service.events.ExtractionFailureEvent;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.service.retry.RetryConfig;
import com.phillippitts.callintel.service.retry.RetryExecutor;
import com.phillippitts.callintel.service.retry.RetryPredicates;
import com.phillippitts.callintel.testutil.EventCapturingPublisher;
import com.phillippitts.callintel.testutil.LeadAnalysisFixtures;
import com.phillippitts.callintel.testutil.RecordingSleeper;
import com.phillippitts.callintel.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiResponsesExtractionClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-14T15:30:45Z"), ZoneOffset.UTC);
    private static final String PROMPT_NOT_FOUND_BODY =
            "{\"error\":{\"message\":\"Prompt with id 'pmpt_missing' not found.\"}}";

    private ScriptedTransport transport;
    private EventCapturingPublisher publisher;
    private RecordingSleeper sleeper;
    private RetryExecutor retryExecutor;
    private RetryConfig retryConfig;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        publisher = new EventCapturingPublisher();
        sleeper = new RecordingSleeper();
        retryExecutor = new RetryExecutor(new SyncExecutor(), sleeper, () -> 0.5);
        retryConfig = RetryConfig.builder()
                .maxRetries(3)
                .baseDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofMillis(4000))
                .backoffMultiplier(2.0)
                .retryable(RetryPredicates.matchingTokens("429", "500", "503", "ECONNABORTED", "ETIMEDOUT"))
                .build();
    }

    private OpenAiResponsesExtractionClient client(String fallbackModel) {
        return new OpenAiResponsesExtractionClient(transport, new ExtractionPromptBuilder(CLOCK, ZoneId.of("UTC")),
                retryExecutor, retryConfig, fallbackModel, publisher,
                new PipelineMetrics(new SimpleMeterRegistry()), CLOCK);
    }

    private static JSONObject analysisResponse() {
        return LeadAnalysisFixtures.responseWithText(LeadAnalysisFixtures.analysisJson(15, "Hot", "x").toString());
    }

    private static UpstreamException httpError(int status, String body) {
        return RestTemplateResponsesTransport.classify("pmpt_missing", status, body, null);
    }

    @Test
    void sendsPromptTemplateRequestAndReturnsParsedJson() {
        transport.respond(OpenAiResponsesExtractionClientTest::analysisResponse);

        JSONObject result = client(null).extract("pmpt_ind", "Caller wants pricing.", null);

        assertThat(result.getInt("total_score")).isEqualTo(75);
        JSONObject request = transport.requests.get(0);
        assertThat(request.getJSONObject("prompt").getString("id")).isEqualTo("pmpt_ind");
        assertThat(request.has("model")).isFalse();
        JSONArray input = request.getJSONArray("input");
        assertThat(input.length()).isEqualTo(1);
        assertThat(input.getJSONObject(0).getString("role")).isEqualTo("user");
        assertThat(input.getJSONObject(0).getString("content")).endsWith("Caller wants pricing.");
        assertThat(publisher.failureEvents()).isEmpty();
    }

    @Test
    void completeAnalysisCarriesHistory() {
        transport.respond(OpenAiResponsesExtractionClientTest::analysisResponse);

        client(null).extract("pmpt_comp", "current", new ExtractionHistory(List.of("earlier"), List.of()));

        String content = transport.requests.get(0).getJSONArray("input").getJSONObject(0).getString("content");
        assertThat(content).contains("=== CALL 1 TRANSCRIPT ===\nearlier");
        assertThat(content).endsWith("=== CURRENT CALL (Call 2) TRANSCRIPT ===\ncurrent");
    }

    @Test
    void retriesRateLimitWithoutPublishingEvent() {
        transport.fail(httpError(429, "{\"error\":{\"message\":\"Rate limit\"}}"))
                .respond(OpenAiResponsesExtractionClientTest::analysisResponse);

        JSONObject result = client(null).extract("pmpt_ind", "t", null);

        assertThat(result).isNotNull();
        assertThat(transport.requests).hasSize(2);
        assertThat(sleeper.sleepMillis()).containsExactly(1000L);
        assertThat(publisher.failureEvents()).isEmpty();
    }

    @Test
    void stopsOnClientErrorAndPublishesOneEvent() {
        transport.fail(httpError(400, "{\"error\":{\"message\":\"Invalid input\"}}"));

        assertThatThrownBy(() -> client(null).extract("pmpt_ind", "t", null))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("Invalid input");

        assertThat(transport.requests).hasSize(1);
        assertThat(publisher.failureEvents()).singleElement().satisfies(event -> {
            assertThat(event.errorType()).isEqualTo(ExtractionFailureEvent.API_FAILURE);
            assertThat(event.operation()).isEqualTo("individual");
            assertThat(event.statusCode()).isEqualTo(400);
            assertThat(event.attempts()).isEqualTo(1);
            assertThat(event.occurredAt()).isEqualTo(CLOCK.instant());
        });
    }

    @Test
    void publishesEventWithAttemptCountWhenRetriesExhausted() {
        for (int i = 0; i < 4; i++) {
            transport.fail(httpError(503, "{\"error\":{\"message\":\"Overloaded\"}}"));
        }

        assertThatThrownBy(() -> client(null).extract("pmpt_comp", "t", new ExtractionHistory(List.of("a"), null)))
                .isInstanceOf(UpstreamException.class);

        assertThat(transport.requests).hasSize(4);
        assertThat(sleeper.sleepMillis()).containsExactly(1000L, 2000L, 4000L);
        assertThat(publisher.failureEvents()).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo("complete");
            assertThat(event.attempts()).isEqualTo(4);
            assertThat(event.errorCode()).isEqualTo("503");
        });
    }

    @Test
    void fallsBackToModelWhenPromptUnknown() {
        transport.fail(httpError(404, PROMPT_NOT_FOUND_BODY))
                .respond(OpenAiResponsesExtractionClientTest::analysisResponse);

        JSONObject result = client("gpt-4o-mini").extract("pmpt_missing", "Caller wants pricing.", null);

        assertThat(result.getString("lead_status_tag")).isEqualTo("Hot");
        assertThat(transport.requests).hasSize(2);
        JSONObject fallback = transport.requests.get(1);
        assertThat(fallback.has("prompt")).isFalse();
        assertThat(fallback.getString("model")).isEqualTo("gpt-4o-mini");
        JSONArray input = fallback.getJSONArray("input");
        assertThat(input.getJSONObject(0).getString("role")).isEqualTo("system");
        assertThat(input.getJSONObject(0).getString("content"))
                .isEqualTo(OpenAiResponsesExtractionClient.RAW_JSON_INSTRUCTION);
        assertThat(input.getJSONObject(1).getString("content")).endsWith("Caller wants pricing.");
        assertThat(publisher.failureEvents()).isEmpty();
    }

    @Test
    void unknownPromptWithoutFallbackIsConfigurationError() {
        transport.fail(httpError(404, PROMPT_NOT_FOUND_BODY));

        assertThatThrownBy(() -> client("  ").extract("pmpt_missing", "t", null))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> {
                    assertThat(e.getSetting()).isEqualTo("extraction.openai.fallback-model");
                    assertThat(e.getMessage()).contains("pmpt_missing");
                });

        assertThat(transport.requests).hasSize(1);
        assertThat(publisher.failureEvents()).isEmpty();
    }

    @Test
    void failedFallbackPublishesFallbackEvent() {
        transport.fail(httpError(404, PROMPT_NOT_FOUND_BODY))
                .fail(httpError(500, "{\"error\":{\"message\":\"Server error\"}}"));

        assertThatThrownBy(() -> client("gpt-4o-mini").extract("pmpt_missing", "t", null))
                .isInstanceOf(UpstreamException.class)
                .isNotInstanceOf(PromptNotFoundException.class);

        assertThat(transport.requests).hasSize(2);
        assertThat(publisher.failureEvents()).singleElement().satisfies(event -> {
            assertThat(event.operation()).isEqualTo("individual_fallback");
            assertThat(event.attempts()).isEqualTo(1);
            assertThat(event.statusCode()).isEqualTo(500);
        });
    }

    @Test
    void unparseableOutputPublishesParseFailure() {
        transport.respond(() -> LeadAnalysisFixtures.responseWithText("I could not analyse this call."));

        assertThatThrownBy(() -> client(null).extract("pmpt_ind", "t", null))
                .isInstanceOf(MalformedResponseException.class);

        assertThat(publisher.failureEvents()).singleElement().satisfies(event -> {
            assertThat(event.errorType()).isEqualTo(ExtractionFailureEvent.PARSE_FAILURE);
            assertThat(event.errorCode()).isEqualTo(MalformedResponseException.ERROR_CODE);
        });
    }

    /**
     * Transport that plays back a script of responses and failures and records every request.
     */
    private static final class ScriptedTransport implements ResponsesApiTransport {
        private final Deque<Supplier<JSONObject>> script = new ArrayDeque<>();
        private final List<JSONObject> requests = new ArrayList<>();

        ScriptedTransport respond(Supplier<JSONObject> response) {
            script.add(response);
            return this;
        }

        ScriptedTransport fail(RuntimeException error) {
            script.add(() -> {
                throw error;
            });
            return this;
        }

        @Override
        public JSONObject createResponse(JSONObject request) {
            requests.add(new JSONObject(request.toString()));
            Supplier<JSONObject> next = script.poll();
            if (next == null) {
                throw new IllegalStateException("No scripted response left");
            }
            return next.get();
        }
    }
}
