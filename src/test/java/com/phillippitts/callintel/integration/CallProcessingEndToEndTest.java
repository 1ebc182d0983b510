package com.phillippitts.callintel.integration;

import com.phillippitts.callintel.config.properties.ExtractionProperties;
import com.phillippitts.callintel.domain.CallRecord;
import com.phillippitts.callintel.domain.StageStatus;
import com.phillippitts.callintel.exception.ErrorCategory;
import com.phillippitts.callintel.exception.UpstreamException;
import com.phillippitts.callintel.repository.JdbcCallRecordRepository;
import com.phillippitts.callintel.repository.JdbcUserPromptRepository;
import com.phillippitts.callintel.service.extraction.ExtractionOrchestrator;
import com.phillippitts.callintel.service.extraction.ExtractionPromptBuilder;
import com.phillippitts.callintel.service.extraction.OpenAiResponsesExtractionClient;
import com.phillippitts.callintel.service.extraction.PromptTemplateResolver;
import com.phillippitts.callintel.service.extraction.ResponsesApiTransport;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.service.pipeline.CallProcessingPipeline;
import com.phillippitts.callintel.service.retry.RetryConfig;
import com.phillippitts.callintel.service.retry.RetryExecutor;
import com.phillippitts.callintel.service.retry.RetryPredicates;
import com.phillippitts.callintel.service.transcription.RecordingUrlResolver;
import com.phillippitts.callintel.service.transcription.SpeechToTextClient;
import com.phillippitts.callintel.service.transcription.TranscriptionWorker;
import com.phillippitts.callintel.testutil.EventCapturingPublisher;
import com.phillippitts.callintel.testutil.LeadAnalysisFixtures;
import com.phillippitts.callintel.testutil.RecordingSleeper;
import com.phillippitts.callintel.testutil.SyncExecutor;
import com.phillippitts.callintel.testutil.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs both stages against an in-memory database with scripted speech-to-text and
 * reasoning-service doubles.
 */
class CallProcessingEndToEndTest {

    private static final Instant NOW = Instant.parse("2025-03-14T15:30:45Z");
    private static final String USER = "user-1";
    private static final String PHONE = "+15550100001";

    private TestDatabase db;
    private JdbcCallRecordRepository repository;
    private RecordingSleeper sleeper;
    private EventCapturingPublisher publisher;
    private final Map<String, Integer> notYetAvailableCount = new ConcurrentHashMap<>();
    private final AtomicInteger sttCalls = new AtomicInteger();
    private final List<JSONObject> extractionRequests = new CopyOnWriteArrayList<>();
    private volatile RuntimeException extractionFailure;
    private CallProcessingPipeline pipeline;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        repository = new JdbcCallRecordRepository(db.jdbc(), clock);
        sleeper = new RecordingSleeper();
        publisher = new EventCapturingPublisher();
        PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());
        RetryExecutor retryExecutor = new RetryExecutor(new SyncExecutor(), sleeper, () -> 0.5);

        SpeechToTextClient stt = url -> {
            sttCalls.incrementAndGet();
            int remaining = notYetAvailableCount.getOrDefault(url, 0);
            if (remaining > 0) {
                notYetAvailableCount.put(url, remaining - 1);
                throw new UpstreamException("Recording download failed with status 404: Recording not found",
                        "recording", 404, "404", ErrorCategory.NOT_YET_AVAILABLE);
            }
            return "Transcript of " + url.substring(url.lastIndexOf('/') + 1);
        };
        RetryConfig transcriptionRetry = RetryConfig.builder()
                .maxRetries(5)
                .baseDelay(Duration.ofMillis(2000))
                .maxDelay(Duration.ofMillis(20000))
                .retryable(UpstreamException.hasCategory(ErrorCategory.NOT_YET_AVAILABLE))
                .build();
        TranscriptionWorker transcriptionWorker = new TranscriptionWorker(repository,
                new RecordingUrlResolver(repository, sleeper, Duration.ofMillis(2000), Duration.ofMillis(60000)),
                stt, retryExecutor, transcriptionRetry, Duration.ofSeconds(5), metrics);

        ResponsesApiTransport transport = request -> {
            extractionRequests.add(new JSONObject(request.toString()));
            if (extractionFailure != null) {
                throw extractionFailure;
            }
            boolean complete = "pmpt_complete".equals(request.getJSONObject("prompt").getString("id"));
            JSONObject analysis = complete
                    ? LeadAnalysisFixtures.analysisJson(18, "Hot", "complete-level note")
                    : LeadAnalysisFixtures.analysisJson(12, "Warm", "Mentioned a competitor");
            return LeadAnalysisFixtures.responseWithText(analysis.toString());
        };
        RetryConfig extractionRetry = RetryConfig.builder()
                .maxRetries(3)
                .baseDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofMillis(4000))
                .retryable(RetryPredicates.matchingTokens("429", "500", "503", "ECONNABORTED", "ETIMEDOUT"))
                .build();
        OpenAiResponsesExtractionClient client = new OpenAiResponsesExtractionClient(transport,
                new ExtractionPromptBuilder(clock, ZoneId.of("UTC")), retryExecutor, extractionRetry, null,
                publisher, metrics, clock);
        ExtractionProperties props = new ExtractionProperties("sk-test", "https://api.openai.com/v1", 30000,
                "pmpt_individual", "pmpt_complete", null, 3, 1000, "UTC");
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(repository,
                new JdbcUserPromptRepository(db.jdbc()), new PromptTemplateResolver(props), client, 5, metrics);

        pipeline = new CallProcessingPipeline(transcriptionWorker, orchestrator, new SyncExecutor());
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void firstCallGetsIdenticalCompleteAnalysisWithoutNotification() {
        db.insertCall("call-1", USER, PHONE, "https://rec/one.mp3", NOW.minus(Duration.ofDays(2)));

        pipeline.process("call-1");

        CallRecord record = repository.findById("call-1").orElseThrow();
        assertThat(record.transcriptStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(record.transcriptText()).isEqualTo("Transcript of one.mp3");
        assertThat(record.leadExtractionStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(record.individualAnalysis().extraction().smartNotification()).isEqualTo("Mentioned a competitor");
        assertThat(record.completeAnalysis()).isEqualTo(record.individualAnalysis().withoutSmartNotification());
        assertThat(extractionRequests).hasSize(1);
    }

    @Test
    void secondCallFromSameContactUsesHistory() {
        db.insertCall("call-1", USER, PHONE, "https://rec/one.mp3", NOW.minus(Duration.ofDays(2)));
        pipeline.process("call-1");
        db.insertCall("call-2", USER, PHONE, "https://rec/two.mp3", NOW.minus(Duration.ofHours(1)));

        pipeline.process("call-2");

        CallRecord second = repository.findById("call-2").orElseThrow();
        assertThat(second.leadExtractionStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(second.individualAnalysis().leadStatusTag()).isEqualTo("Warm");
        assertThat(second.completeAnalysis().leadStatusTag()).isEqualTo("Hot");
        assertThat(second.completeAnalysis().extraction().smartNotification()).isEmpty();

        JSONObject completeRequest = extractionRequests.get(extractionRequests.size() - 1);
        assertThat(completeRequest.getJSONObject("prompt").getString("id")).isEqualTo("pmpt_complete");
        String content = completeRequest.getJSONArray("input").getJSONObject(0).getString("content");
        assertThat(content).contains("=== CALL 1 TRANSCRIPT ===\nTranscript of one.mp3");
        assertThat(content).endsWith("=== CURRENT CALL (Call 2) TRANSCRIPT ===\nTranscript of two.mp3");
    }

    @Test
    void waitsForLateRecordingAndRetriesUntilDownloadable() {
        db.insertCall("call-1", USER, PHONE, null, NOW);
        notYetAvailableCount.put("https://rec/late.mp3", 2);
        AtomicInteger polls = new AtomicInteger();
        sleeper.onSleep(() -> {
            if (polls.incrementAndGet() == 3) {
                db.update("call-1", Map.of("recording_url", "https://rec/late.mp3"));
            }
        });

        pipeline.process("call-1");

        CallRecord record = repository.findById("call-1").orElseThrow();
        assertThat(record.transcriptStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(record.leadExtractionStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(sttCalls.get()).isEqualTo(3);
        assertThat(sleeper.sleepMillis()).containsExactly(2000L, 2000L, 2000L, 2000L, 4000L);
    }

    @Test
    void failedExtractionKeepsTranscriptAndCanBeRetried() {
        db.insertCall("call-1", USER, PHONE, "https://rec/one.mp3", NOW);
        extractionFailure = new UpstreamException("Responses API call failed: Invalid input (status=400)",
                "openai", 400, "400", ErrorCategory.PERMANENT_UPSTREAM);

        pipeline.process("call-1");

        CallRecord failed = repository.findById("call-1").orElseThrow();
        assertThat(failed.transcriptStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(failed.leadExtractionStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(failed.leadExtractionError()).isEqualTo("Responses API call failed: Invalid input (status=400)");
        assertThat(failed.individualAnalysis()).isNull();
        assertThat(publisher.failureEvents()).hasSize(1);

        extractionFailure = null;
        pipeline.submitExtraction("call-1").join();

        CallRecord recovered = repository.findById("call-1").orElseThrow();
        assertThat(recovered.leadExtractionStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(recovered.leadExtractionError()).isNull();
        assertThat(sttCalls.get()).isEqualTo(1);
    }

    @Test
    void duplicateSubmissionsProcessCallOnce() throws Exception {
        db.insertCall("call-1", USER, PHONE, "https://rec/one.mp3", NOW);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<CompletableFuture<Void>> runs = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 4; i++) {
                runs.add(CompletableFuture.runAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    pipeline.process("call-1");
                }, pool));
            }
            start.countDown();
            CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        CallRecord record = repository.findById("call-1").orElseThrow();
        assertThat(record.transcriptStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(record.leadExtractionStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(sttCalls.get()).isEqualTo(1);
        assertThat(extractionRequests).hasSize(1);
    }
}
