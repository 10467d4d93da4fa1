package net.salescoach.adapters.persistence;

import java.sql.Array;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.salescoach.domain.account.CallRecord;
import net.salescoach.domain.analysis.AnalysisKind;
import net.salescoach.domain.analysis.RawAnalysisRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for call transcripts and their stored per-kind analysis blobs.
 */
@Repository
public class CallRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(CallRecordRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public CallRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Lists an account's calls, newest call date first.
     */
    @Transactional(readOnly = true)
    public List<CallRecord> findByAccountNewestFirst(UUID accountId) {
        String sql = """
            SELECT id, call_date, call_type, raw_text, created_at
            FROM call_transcripts
            WHERE prospect_id = ? AND deleted_at IS NULL
            ORDER BY call_date DESC NULLS LAST, created_at DESC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Date callDate = rs.getDate("call_date");
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new CallRecord(
                rs.getObject("id", UUID.class),
                callDate != null ? callDate.toLocalDate() : null,
                rs.getString("call_type"),
                rs.getString("raw_text"),
                createdAt != null ? createdAt.toInstant() : null
            );
        }, accountId);
    }

    /**
     * Loads the analysis blobs for a batch of calls in one query.
     *
     * <p>Calls without an analysis row are absent from the result.</p>
     */
    @Transactional(readOnly = true)
    public Map<UUID, RawAnalysisRecord> findAnalysesByCallIds(List<UUID> callIds) {
        if (callIds == null || callIds.isEmpty()) {
            return Map.of();
        }
        StringBuilder columns = new StringBuilder("call_id");
        for (AnalysisKind kind : AnalysisKind.values()) {
            columns.append(", ").append(kind.columnName());
        }
        String sql = "SELECT " + columns + " FROM ai_call_analysis"
            + " WHERE call_id = ANY(?::UUID[]) AND deleted_at IS NULL";

        Map<UUID, RawAnalysisRecord> records = new HashMap<>();
        jdbcTemplate.query(
            connection -> {
                PreparedStatement statement = connection.prepareStatement(sql);
                Array idArray = connection.createArrayOf("uuid", callIds.toArray());
                statement.setArray(1, idArray);
                return statement;
            },
            rs -> {
                UUID callId = rs.getObject("call_id", UUID.class);
                records.put(callId, new RawAnalysisRecord(callId, readBlobs(rs, callId)));
            }
        );
        return records;
    }

    private Map<AnalysisKind, JsonNode> readBlobs(ResultSet rs, UUID callId) throws SQLException {
        Map<AnalysisKind, JsonNode> blobs = new HashMap<>();
        for (AnalysisKind kind : AnalysisKind.values()) {
            String json = rs.getString(kind.columnName());
            if (json == null) {
                continue;
            }
            try {
                blobs.put(kind, objectMapper.readTree(json));
            } catch (JacksonException ex) {
                // Left absent so the validator reports the kind as not yet analyzed.
                log.warn("Stored {} analysis for callId={} is not valid JSON: {}",
                    kind.wireName(), callId, ex.getOriginalMessage());
            }
        }
        return blobs;
    }
}
