package com.phillippitts.callintel.config;

import com.phillippitts.callintel.config.properties.ExtractionProperties;
import com.phillippitts.callintel.config.properties.PipelineProperties;
import com.phillippitts.callintel.repository.CallRecordRepository;
import com.phillippitts.callintel.repository.UserPromptRepository;
import com.phillippitts.callintel.service.extraction.ExtractionOrchestrator;
import com.phillippitts.callintel.service.extraction.ExtractionPromptBuilder;
import com.phillippitts.callintel.service.extraction.OpenAiResponsesExtractionClient;
import com.phillippitts.callintel.service.extraction.PromptTemplateResolver;
import com.phillippitts.callintel.service.extraction.ResponsesApiTransport;
import com.phillippitts.callintel.service.extraction.RestTemplateResponsesTransport;
import com.phillippitts.callintel.service.extraction.StructuredExtractionClient;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.service.retry.RetryConfig;
import com.phillippitts.callintel.service.retry.RetryExecutor;
import com.phillippitts.callintel.service.retry.RetryPredicates;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the lead-extraction stage and its OpenAI Responses API client.
 */
@Configuration
public class ExtractionConfig {

    /** Failure codes worth retrying: rate limit, server errors and timeouts. */
    static final String[] TRANSIENT_TOKENS = {"429", "500", "503", "ECONNABORTED", "ETIMEDOUT"};

    private final ExtractionProperties extractionProperties;

    public ExtractionConfig(ExtractionProperties extractionProperties) {
        this.extractionProperties = extractionProperties;
    }

    /**
     * Exponential backoff from {@code retry-delay-ms}, doubling per retry. The cap equals the
     * last scheduled delay, so it never shortens one.
     */
    @Bean
    @Qualifier("extractionRetryConfig")
    public RetryConfig extractionRetryConfig() {
        int maxRetries = extractionProperties.maxRetries();
        long base = extractionProperties.retryDelayMs();
        return RetryConfig.builder()
                .maxRetries(maxRetries)
                .baseDelay(Duration.ofMillis(base))
                .maxDelay(Duration.ofMillis(maxBackoffMillis(base, maxRetries)))
                .backoffMultiplier(2.0)
                .retryable(RetryPredicates.matchingTokens(TRANSIENT_TOKENS))
                .build();
    }

    /** {@code base * 2^(maxRetries-1)}, saturating at {@link Long#MAX_VALUE}. */
    static long maxBackoffMillis(long base, int maxRetries) {
        int doublings = Math.min(Math.max(0, maxRetries - 1), 62);
        try {
            return Math.multiplyExact(base, 1L << doublings);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Bean
    @Qualifier("openAiRestTemplate")
    public RestTemplate openAiRestTemplate() {
        return PipelineConfig.restTemplate(Duration.ofMillis(extractionProperties.timeoutMs()));
    }

    @Bean
    public ResponsesApiTransport responsesApiTransport(@Qualifier("openAiRestTemplate") RestTemplate restTemplate) {
        return new RestTemplateResponsesTransport(restTemplate, extractionProperties.baseUrl(),
                extractionProperties.apiKey());
    }

    @Bean
    public ExtractionPromptBuilder extractionPromptBuilder(Clock clock) {
        return new ExtractionPromptBuilder(clock, ZoneId.of(extractionProperties.promptTimezone()));
    }

    @Bean
    public PromptTemplateResolver promptTemplateResolver() {
        return new PromptTemplateResolver(extractionProperties);
    }

    @Bean
    public StructuredExtractionClient structuredExtractionClient(ResponsesApiTransport transport,
                                                                 ExtractionPromptBuilder promptBuilder,
                                                                 RetryExecutor retryExecutor,
                                                                 @Qualifier("extractionRetryConfig") RetryConfig retryConfig,
                                                                 ApplicationEventPublisher publisher,
                                                                 PipelineMetrics metrics,
                                                                 Clock clock) {
        return new OpenAiResponsesExtractionClient(transport, promptBuilder, retryExecutor, retryConfig,
                extractionProperties.fallbackModel(), publisher, metrics, clock);
    }

    @Bean
    public ExtractionOrchestrator extractionOrchestrator(CallRecordRepository repository,
                                                         UserPromptRepository userPromptRepository,
                                                         PromptTemplateResolver promptResolver,
                                                         StructuredExtractionClient extractionClient,
                                                         PipelineProperties pipelineProperties,
                                                         PipelineMetrics metrics) {
        return new ExtractionOrchestrator(repository, userPromptRepository, promptResolver, extractionClient,
                pipelineProperties.priorCallLimit(), metrics);
    }
}
