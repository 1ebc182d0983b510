package com.phillippitts.callintel.service.pipeline;

import com.phillippitts.callintel.config.properties.PipelineProperties;
import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.repository.CallRecordRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reports records that have been {@code processing} for longer than
 * {@code pipeline.stuck-threshold-minutes}. A worker that died mid-stage leaves its claim in
 * place; such records are only logged here and must be reset by an operator.
 */
@Component
public class StuckRecordMonitor {

    private static final Logger LOG = LogManager.getLogger(StuckRecordMonitor.class);

    private final CallRecordRepository repository;
    private final PipelineProperties props;
    private final Clock clock;

    public StuckRecordMonitor(CallRecordRepository repository, PipelineProperties props, Clock clock) {
        this.repository = repository;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${pipeline.stuck-check-interval-ms:300000}",
            initialDelayString = "${pipeline.stuck-check-initial-delay-ms:60000}")
    public void reportStuckRecords() {
        try {
            findStuck().forEach((stage, ids) -> LOG.warn(
                    "{} call record(s) stuck in {} processing for over {} min (manual reset required): {}",
                    ids.size(), stage.columnPrefix(), props.stuckThresholdMinutes(), ids));
        } catch (RuntimeException e) {
            LOG.error("Stuck-record check failed", e);
        }
    }

    Map<ProcessingStage, List<String>> findStuck() {
        Instant cutoff = clock.instant().minus(props.stuckThreshold());
        Map<ProcessingStage, List<String>> stuck = new EnumMap<>(ProcessingStage.class);
        for (ProcessingStage stage : ProcessingStage.values()) {
            List<String> ids = repository.findStuckInProcessing(stage, cutoff);
            if (!ids.isEmpty()) {
                stuck.put(stage, ids);
            }
        }
        return stuck;
    }
}
