package com.phillippitts.callintel.config;

import com.phillippitts.callintel.config.properties.PipelineProperties;
import com.phillippitts.callintel.config.properties.SpeechToTextProperties;
import com.phillippitts.callintel.exception.ErrorCategory;
import com.phillippitts.callintel.exception.UpstreamException;
import com.phillippitts.callintel.repository.CallRecordRepository;
import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.service.retry.RetryConfig;
import com.phillippitts.callintel.service.retry.RetryExecutor;
import com.phillippitts.callintel.service.retry.Sleeper;
import com.phillippitts.callintel.service.transcription.RecordingUrlResolver;
import com.phillippitts.callintel.service.transcription.SpeechToTextClient;
import com.phillippitts.callintel.service.transcription.TranscriptionWorker;
import com.phillippitts.callintel.service.transcription.WhisperApiSpeechToTextClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the shared retry engine and the transcript stage.
 */
@Configuration
public class PipelineConfig {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final PipelineProperties pipelineProperties;

    public PipelineConfig(PipelineProperties pipelineProperties) {
        this.pipelineProperties = pipelineProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Stateless retry engine shared by all stages. Per-attempt timeouts run on the timeout executor.
     */
    @Bean
    public RetryExecutor retryExecutor(@Qualifier("timeoutExecutor") Executor timeoutExecutor) {
        return new RetryExecutor(timeoutExecutor);
    }

    /**
     * Speech-to-text retry policy: only failures that mean "recording not downloadable yet"
     * (HTTP 403/404, "Recording not found") are retried, 2 s doubling up to 20 s.
     */
    @Bean
    @Qualifier("transcriptionRetryConfig")
    public RetryConfig transcriptionRetryConfig() {
        return RetryConfig.builder()
                .maxRetries(pipelineProperties.transcriptionMaxAttempts() - 1)
                .baseDelay(Duration.ofMillis(pipelineProperties.transcriptionBaseDelayMs()))
                .maxDelay(Duration.ofMillis(Math.max(pipelineProperties.transcriptionBaseDelayMs(),
                        pipelineProperties.transcriptionMaxDelayMs())))
                .backoffMultiplier(2.0)
                .retryable(UpstreamException.hasCategory(ErrorCategory.NOT_YET_AVAILABLE))
                .build();
    }

    @Bean
    @Qualifier("sttRestTemplate")
    public RestTemplate sttRestTemplate(SpeechToTextProperties props) {
        return restTemplate(Duration.ofMillis(props.timeoutMs()));
    }

    @Bean
    public SpeechToTextClient speechToTextClient(@Qualifier("sttRestTemplate") RestTemplate restTemplate,
                                                 SpeechToTextProperties props) {
        return new WhisperApiSpeechToTextClient(restTemplate, props);
    }

    @Bean
    public RecordingUrlResolver recordingUrlResolver(CallRecordRepository repository) {
        return new RecordingUrlResolver(repository, Sleeper.threadSleep(),
                pipelineProperties.recordingPollInterval(), pipelineProperties.recordingWaitTimeout());
    }

    @Bean
    public TranscriptionWorker transcriptionWorker(CallRecordRepository repository,
                                                   RecordingUrlResolver recordingUrlResolver,
                                                   SpeechToTextClient speechToTextClient,
                                                   RetryExecutor retryExecutor,
                                                   @Qualifier("transcriptionRetryConfig") RetryConfig retryConfig,
                                                   PipelineMetrics metrics) {
        return new TranscriptionWorker(repository, recordingUrlResolver, speechToTextClient, retryExecutor,
                retryConfig, pipelineProperties.transcriptionAttemptTimeout(), metrics);
    }

    static RestTemplate restTemplate(Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) CONNECT_TIMEOUT.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return new RestTemplate(factory);
    }
}
