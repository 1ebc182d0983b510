package com.phillippitts.callintel.service.pipeline;

import com.phillippitts.callintel.config.properties.PipelineProperties;
import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.repository.CallRecordRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StuckRecordMonitorTest {

    private static final Instant NOW = Instant.parse("2025-03-14T10:00:00Z");
    private static final PipelineProperties PROPS =
            new PipelineProperties(2000, 60000, 6, 2000, 20000, 120000, 5, 15);

    private final CallRecordRepository repository = mock(CallRecordRepository.class);
    private final StuckRecordMonitor monitor =
            new StuckRecordMonitor(repository, PROPS, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void groupsStuckRecordsByStageUsingThresholdCutoff() {
        Instant cutoff = Instant.parse("2025-03-14T09:45:00Z");
        when(repository.findStuckInProcessing(ProcessingStage.TRANSCRIPT, cutoff)).thenReturn(List.of("call-1"));
        when(repository.findStuckInProcessing(ProcessingStage.LEAD_EXTRACTION, cutoff)).thenReturn(List.of());

        Map<ProcessingStage, List<String>> stuck = monitor.findStuck();

        assertThat(stuck).containsOnlyKeys(ProcessingStage.TRANSCRIPT);
        assertThat(stuck.get(ProcessingStage.TRANSCRIPT)).containsExactly("call-1");
    }

    @Test
    void reportSurvivesRepositoryFailure() {
        when(repository.findStuckInProcessing(any(), any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(monitor::reportStuckRecords).doesNotThrowAnyException();
    }
}
