package com.company.sentinel.repository;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.PhaseTimings;
import com.company.sentinel.domain.enums.FailureReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw probe results, one row per (website_id, checked_at)
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CheckResultRepository {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_BASE = """
        SELECT website_id, checked_at, response_time_ms, http_status, success, regex_matched,
               failure_reason, failure_message, content_size_bytes,
               dns_lookup_time_ms, connection_time_ms, tls_handshake_time_ms,
               server_processing_time_ms, content_transfer_time_ms, check_details
        FROM monitoring_results
        """;

    /**
     * Insert one result. A row with the same key is left untouched.
     *
     * @return true if a row was written, false if the key already existed
     */
    public boolean insert(CheckResult result) {
        String sql = """
            INSERT INTO monitoring_results (
                website_id, checked_at, response_time_ms, http_status, success, regex_matched,
                failure_reason, failure_message, content_size_bytes,
                dns_lookup_time_ms, connection_time_ms, tls_handshake_time_ms,
                server_processing_time_ms, content_transfer_time_ms, check_details
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (website_id, checked_at) DO NOTHING
            """;

        PhaseTimings timings = result.getTimings() != null ? result.getTimings() : PhaseTimings.EMPTY;
        int rows = jdbcTemplate.update(sql,
                result.getTargetId(),
                Timestamp.from(result.getCheckedAt()),
                result.getResponseTimeMs(),
                result.getHttpStatus(),
                result.isSuccess(),
                result.getRegexMatched(),
                result.getFailureReason() != null ? result.getFailureReason().getCode() : null,
                result.getFailureMessage(),
                result.getContentSizeBytes(),
                timings.getDnsLookupMs(),
                timings.getConnectionMs(),
                timings.getTlsHandshakeMs(),
                timings.getServerProcessingMs(),
                timings.getContentTransferMs(),
                toJson(result.getDetails())
        );
        return rows > 0;
    }

    public List<CheckResult> findInRange(Instant fromInclusive, Instant toExclusive) {
        String sql = SELECT_BASE + """
            WHERE checked_at >= ? AND checked_at < ?
            ORDER BY checked_at, website_id
            """;
        return jdbcTemplate.query(sql, new CheckResultRowMapper(),
                Timestamp.from(fromInclusive), Timestamp.from(toExclusive));
    }

    public Optional<Instant> findOldestCheckedAt() {
        Timestamp oldest = jdbcTemplate.queryForObject(
                "SELECT MIN(checked_at) FROM monitoring_results", Timestamp.class);
        return Optional.ofNullable(oldest).map(Timestamp::toInstant);
    }

    public int deleteBefore(Instant cutoff) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM monitoring_results WHERE checked_at < ?", Timestamp.from(cutoff));
        log.info("Deleted {} raw result(s) checked before {}", deleted, cutoff);
        return deleted;
    }

    private String toJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            // The row is still worth keeping without its details
            log.warn("Failed to serialize check details, storing without them", e);
            return null;
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable check_details column: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private class CheckResultRowMapper implements RowMapper<CheckResult> {
        @Override
        public CheckResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CheckResult.builder()
                    .targetId(rs.getLong("website_id"))
                    .checkedAt(rs.getTimestamp("checked_at").toInstant())
                    .responseTimeMs(rs.getObject("response_time_ms", Double.class))
                    .httpStatus(rs.getObject("http_status", Integer.class))
                    .success(rs.getBoolean("success"))
                    .regexMatched(rs.getObject("regex_matched", Boolean.class))
                    .failureReason(FailureReason.fromCode(rs.getString("failure_reason")))
                    .failureMessage(rs.getString("failure_message"))
                    .contentSizeBytes(rs.getObject("content_size_bytes", Long.class))
                    .timings(PhaseTimings.builder()
                            .dnsLookupMs(rs.getObject("dns_lookup_time_ms", Double.class))
                            .connectionMs(rs.getObject("connection_time_ms", Double.class))
                            .tlsHandshakeMs(rs.getObject("tls_handshake_time_ms", Double.class))
                            .serverProcessingMs(rs.getObject("server_processing_time_ms", Double.class))
                            .contentTransferMs(rs.getObject("content_transfer_time_ms", Double.class))
                            .build())
                    .details(fromJson(rs.getString("check_details")))
                    .build();
        }
    }
}
