package com.phillippitts.callintel.service.events;

import com.phillippitts.callintel.service.metrics.PipelineMetrics;
import com.phillippitts.callintel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Diagnostic capture for final extraction failures. Every event is counted; ERROR logs are
 * throttled per error type and status to avoid alert noise during an upstream outage.
 */
@Component
class DiagnosticsListener {
    private static final Logger LOG = LogManager.getLogger(DiagnosticsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final PipelineMetrics metrics;
    private final Clock clock;

    DiagnosticsListener(PipelineMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onExtractionFailure(ExtractionFailureEvent e) {
        metrics.incrementDiagnostic(e.errorType());
        String key = e.errorType() + '-' + e.statusCode();
        if (shouldLog(key)) {
            LOG.error("Extraction failure captured: type={}, operation={}, status={}, code={}, attempts={}, message={}",
                    e.errorType(), e.operation(), e.statusCode(), e.errorCode(), e.attempts(),
                    LogSanitizer.truncate(e.message(), 500));
        } else {
            LOG.debug("Extraction failure (throttled): type={}, operation={}", e.errorType(), e.operation());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
