package com.phillippitts.callintel.repository;

import com.phillippitts.callintel.domain.CallRecord;
import com.phillippitts.callintel.domain.LeadAnalysis;
import com.phillippitts.callintel.domain.LeadAnalysisJson;
import com.phillippitts.callintel.domain.PriorCall;
import com.phillippitts.callintel.domain.ProcessingStage;
import com.phillippitts.callintel.domain.StageOutcome;
import com.phillippitts.callintel.domain.StageStatus;
import com.phillippitts.callintel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CallRecordRepository} over the {@code call_records} table.
 *
 * <p>The claim is one conditional {@code UPDATE}; the database serializes concurrent claimers
 * on the row and exactly one of them sees an affected row count of 1. Analyses are stored as
 * JSON text.
 */
@Repository
public class JdbcCallRecordRepository implements CallRecordRepository {

    private static final Logger LOG = LogManager.getLogger(JdbcCallRecordRepository.class);

    static final int MAX_ERROR_LENGTH = 1000;

    private static final String CLAIMABLE_STATUS = "(%s IS NULL OR %s IN ('none', 'failed'))";

    private static final String CLAIM_TEMPLATE = """
            UPDATE call_records
            SET %1$s = 'processing',
                %2$s = NULL,
                %3$s = :now,
                %4$s = :now,
                updated_at = :now
            WHERE id = :id
              AND %5$s
            """;

    private static final String TRANSCRIPT_READY = """
              AND transcript_status = 'completed'
              AND transcript_text IS NOT NULL
              AND TRIM(transcript_text) <> ''
            """;

    private static final String SELECT_BY_ID = """
            SELECT id, user_id, phone_number, recording_url, transcript_text,
                   transcript_status, transcript_error, transcript_started_at, transcript_completed_at,
                   lead_extraction_status, lead_extraction_error,
                   lead_extraction_started_at, lead_extraction_completed_at,
                   lead_individual_analysis, lead_complete_analysis,
                   created_at, updated_at
            FROM call_records
            WHERE id = :id
            """;

    private static final String COMPLETE_TRANSCRIPT = """
            UPDATE call_records
            SET transcript_text = :text,
                transcript_status = 'completed',
                transcript_error = NULL,
                transcript_completed_at = :now,
                transcript_updated_at = :now,
                updated_at = :now
            WHERE id = :id
            """;

    private static final String COMPLETE_LEAD_EXTRACTION = """
            UPDATE call_records
            SET lead_individual_analysis = :individual,
                lead_complete_analysis = :complete,
                lead_extraction_status = 'completed',
                lead_extraction_error = NULL,
                lead_extraction_completed_at = :now,
                lead_extraction_updated_at = :now,
                updated_at = :now
            WHERE id = :id
            """;

    private static final String FAIL_TEMPLATE = """
            UPDATE call_records
            SET %1$s = 'failed',
                %2$s = :error,
                %3$s = :now,
                updated_at = :now
            WHERE id = :id
            """;

    private static final String SELECT_PRIOR_CALLS = """
            SELECT id, transcript_text, transcript_status, lead_individual_analysis, created_at
            FROM call_records
            WHERE user_id = :userId
              AND phone_number = :phone
              AND id <> :excludeId
              AND ((transcript_status = 'completed' AND transcript_text IS NOT NULL)
                   OR lead_individual_analysis IS NOT NULL)
            ORDER BY created_at DESC
            LIMIT :limit
            """;

    private static final String SELECT_STUCK_TEMPLATE = """
            SELECT id
            FROM call_records
            WHERE %1$s = 'processing'
              AND %2$s < :startedBefore
            ORDER BY %2$s
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcCallRecordRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean claimForProcessing(String callId, ProcessingStage stage) {
        Objects.requireNonNull(stage, "stage must not be null");
        String sql = claimSql(stage);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", callId)
                .addValue("now", now());
        int updated = jdbc.update(sql, params);
        LOG.debug("Claim {} for call {}: {} row(s)", stage, callId, updated);
        return updated == 1;
    }

    static String claimSql(ProcessingStage stage) {
        String status = stage.statusColumn();
        String guard = String.format(CLAIMABLE_STATUS, status, status);
        String sql = String.format(CLAIM_TEMPLATE, status, stage.errorColumn(),
                stage.startedAtColumn(), stage.updatedAtColumn(), guard);
        return stage == ProcessingStage.LEAD_EXTRACTION ? sql + TRANSCRIPT_READY : sql;
    }

    @Override
    public Optional<CallRecord> findById(String callId) {
        List<CallRecord> rows = jdbc.query(SELECT_BY_ID, new MapSqlParameterSource("id", callId), CALL_RECORD_MAPPER);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public boolean writeStageResult(String callId, ProcessingStage stage, StageOutcome outcome) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", callId)
                .addValue("now", now());

        String sql;
        if (!outcome.isCompleted()) {
            sql = String.format(FAIL_TEMPLATE, stage.statusColumn(), stage.errorColumn(), stage.updatedAtColumn());
            params.addValue("error", LogSanitizer.truncate(outcome.errorMessage(), MAX_ERROR_LENGTH));
        } else if (stage == ProcessingStage.TRANSCRIPT) {
            sql = COMPLETE_TRANSCRIPT;
            params.addValue("text", outcome.transcriptText());
        } else {
            sql = COMPLETE_LEAD_EXTRACTION;
            params.addValue("individual", LeadAnalysisJson.toJson(outcome.individualAnalysis()).toString());
            params.addValue("complete", LeadAnalysisJson.toJson(outcome.completeAnalysis()).toString());
        }

        int updated = jdbc.update(sql, params);
        if (updated == 0) {
            LOG.warn("Terminal {} write for call {} matched no row", stage, callId);
        }
        return updated > 0;
    }

    @Override
    public List<PriorCall> findRecentPriorCalls(String userId, String phoneNumber, String excludeCallId, int limit) {
        if (userId == null || phoneNumber == null || limit <= 0) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("phone", phoneNumber)
                .addValue("excludeId", excludeCallId == null ? "" : excludeCallId)
                .addValue("limit", limit);
        return jdbc.query(SELECT_PRIOR_CALLS, params, (rs, rowNum) -> new PriorCall(
                rs.getString("id"),
                StageStatus.fromDbValue(rs.getString("transcript_status")) == StageStatus.COMPLETED
                        ? rs.getString("transcript_text") : null,
                analysis(rs, "lead_individual_analysis"),
                instant(rs, "created_at")));
    }

    @Override
    public List<String> findStuckInProcessing(ProcessingStage stage, Instant startedBefore) {
        String sql = String.format(SELECT_STUCK_TEMPLATE, stage.statusColumn(), stage.startedAtColumn());
        return jdbc.queryForList(sql,
                new MapSqlParameterSource("startedBefore", Timestamp.from(startedBefore)), String.class);
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private static final RowMapper<CallRecord> CALL_RECORD_MAPPER = (rs, rowNum) -> new CallRecord(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("phone_number"),
            rs.getString("recording_url"),
            rs.getString("transcript_text"),
            StageStatus.fromDbValue(rs.getString("transcript_status")),
            rs.getString("transcript_error"),
            instant(rs, "transcript_started_at"),
            instant(rs, "transcript_completed_at"),
            StageStatus.fromDbValue(rs.getString("lead_extraction_status")),
            rs.getString("lead_extraction_error"),
            instant(rs, "lead_extraction_started_at"),
            instant(rs, "lead_extraction_completed_at"),
            analysis(rs, "lead_individual_analysis"),
            analysis(rs, "lead_complete_analysis"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static LeadAnalysis analysis(ResultSet rs, String column) throws SQLException {
        String json = rs.getString(column);
        if (json == null || json.isBlank()) {
            return null;
        }
        return LeadAnalysisJson.fromJson(json);
    }
}
