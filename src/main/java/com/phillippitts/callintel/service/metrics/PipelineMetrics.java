package com.phillippitts.callintel.service.metrics;

import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.domain.StageRunResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for call processing.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Stage latency per stage (transcript, lead_extraction)</li>
 *   <li>Stage outcomes (completed, failed, skipped)</li>
 *   <li>Upstream attempts per operation, including retries</li>
 *   <li>Diagnostic captures per error type</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "callintel.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one stage pass: its latency and its outcome.
     *
     * @param stage         stage that ran
     * @param result        how the pass ended
     * @param durationNanos wall-clock duration in nanoseconds
     */
    public void recordStage(ProcessingStage stage, StageRunResult result, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Time taken by one stage pass")
                .tag("stage", stage.columnPrefix())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);

        Counter.builder(METRIC_PREFIX + ".stage.outcome")
                .description("Number of stage passes by outcome")
                .tag("stage", stage.columnPrefix())
                .tag("result", result.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts the upstream attempts one operation needed.
     *
     * @param operation operation label (speech_to_text, extraction)
     * @param attempts  attempts made, including the first one
     */
    public void recordAttempts(String operation, int attempts) {
        Counter.builder(METRIC_PREFIX + ".upstream.attempts")
                .description("Number of upstream attempts, including retries")
                .tag("operation", operation)
                .register(registry)
                .increment(attempts);
    }

    public void incrementDiagnostic(String errorType) {
        Counter.builder(METRIC_PREFIX + ".diagnostics")
                .description("Number of final upstream failures captured for diagnostics")
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }
}
