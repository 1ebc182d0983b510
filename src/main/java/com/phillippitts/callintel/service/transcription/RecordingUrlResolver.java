package com.phillippitts.callintel.service.transcription;

import com.phillippitts.callintel.domain.CallRecord;
import com.phillippitts.callintel.repository.CallRecordRepository;
import com.phillippitts.callintel.service.retry.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Waits for the recording webhook to store a recording URL on a call record.
 *
 * <p>Bounded condition-check-then-sleep loop: the record is re-read every poll interval until
 * the URL appears or the wait timeout is spent. An interrupt ends the wait early.
 */
public class RecordingUrlResolver {

    private static final Logger LOG = LogManager.getLogger(RecordingUrlResolver.class);

    private final CallRecordRepository repository;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final Duration waitTimeout;

    public RecordingUrlResolver(CallRecordRepository repository, Sleeper sleeper,
                                Duration pollInterval, Duration waitTimeout) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    /**
     * @return the recording URL, or empty if it did not arrive within the wait timeout
     */
    public Optional<String> awaitRecordingUrl(String callId) {
        Optional<String> url = currentUrl(callId);
        if (url.isPresent()) {
            return url;
        }

        int polls = maxPolls();
        LOG.info("Recording URL not yet available; polling every {} ms for up to {} ms",
                pollInterval.toMillis(), waitTimeout.toMillis());
        for (int i = 1; i <= polls; i++) {
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for recording URL after {} poll(s)", i - 1);
                return Optional.empty();
            }
            url = currentUrl(callId);
            if (url.isPresent()) {
                LOG.info("Recording URL arrived after {} poll(s)", i);
                return url;
            }
        }
        return Optional.empty();
    }

    public Duration waitTimeout() {
        return waitTimeout;
    }

    int maxPolls() {
        long interval = pollInterval.toMillis();
        return (int) ((waitTimeout.toMillis() + interval - 1) / interval);
    }

    private Optional<String> currentUrl(String callId) {
        return repository.findById(callId)
                .filter(CallRecord::hasRecording)
                .map(CallRecord::recordingUrl);
    }
}
