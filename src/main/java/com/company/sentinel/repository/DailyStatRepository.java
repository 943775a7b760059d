package com.company.sentinel.repository;

import com.company.sentinel.domain.DailyStat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Daily rollups in monitoring_stats, keyed by (website_id, day_date)
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DailyStatRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Additive upsert: counts add up, the average is recombined as a mean
     * weighted by timed checks, min and max are combined
     */
    public void upsert(DailyStat stat) {
        String sql = """
            INSERT INTO monitoring_stats (
                website_id, day_date, total_checks, successful_checks, failure_count,
                timed_checks, avg_response_time_ms, min_response_time_ms, max_response_time_ms,
                updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (website_id, day_date)
            DO UPDATE SET
                total_checks = monitoring_stats.total_checks + EXCLUDED.total_checks,
                successful_checks = monitoring_stats.successful_checks + EXCLUDED.successful_checks,
                failure_count = monitoring_stats.failure_count + EXCLUDED.failure_count,
                timed_checks = monitoring_stats.timed_checks + EXCLUDED.timed_checks,
                avg_response_time_ms = CASE
                    WHEN monitoring_stats.timed_checks + EXCLUDED.timed_checks = 0 THEN NULL
                    ELSE (
                        COALESCE(monitoring_stats.avg_response_time_ms, 0) * monitoring_stats.timed_checks
                        + COALESCE(EXCLUDED.avg_response_time_ms, 0) * EXCLUDED.timed_checks
                    ) / (monitoring_stats.timed_checks + EXCLUDED.timed_checks)
                END,
                min_response_time_ms = LEAST(monitoring_stats.min_response_time_ms, EXCLUDED.min_response_time_ms),
                max_response_time_ms = GREATEST(monitoring_stats.max_response_time_ms, EXCLUDED.max_response_time_ms),
                updated_at = NOW()
            """;

        jdbcTemplate.update(sql,
                stat.getTargetId(),
                Date.valueOf(stat.getDayDate()),
                stat.getTotalChecks(),
                stat.getSuccessfulChecks(),
                stat.getFailureCount(),
                stat.getTimedChecks(),
                stat.getAvgResponseTimeMs(),
                stat.getMinResponseTimeMs(),
                stat.getMaxResponseTimeMs()
        );
    }

    /**
     * Aggregate raw results per target and calendar day of the given zone
     */
    public List<DailyStat> summarizeResults(Instant fromInclusive, Instant toExclusive, ZoneId zone) {
        String sql = """
            SELECT website_id,
                   (checked_at AT TIME ZONE CAST(? AS TEXT))::date AS day_date,
                   COUNT(*) AS total_checks,
                   COUNT(*) FILTER (WHERE success) AS successful_checks,
                   COUNT(*) FILTER (WHERE NOT success) AS failure_count,
                   COUNT(response_time_ms) AS timed_checks,
                   AVG(response_time_ms) AS avg_response_time_ms,
                   MIN(response_time_ms) AS min_response_time_ms,
                   MAX(response_time_ms) AS max_response_time_ms
            FROM monitoring_results
            WHERE checked_at >= ? AND checked_at < ?
            GROUP BY website_id, day_date
            ORDER BY day_date, website_id
            """;

        return jdbcTemplate.query(sql, new DailyStatRowMapper(),
                zone.getId(), Timestamp.from(fromInclusive), Timestamp.from(toExclusive));
    }

    public List<DailyStat> findByTarget(long targetId, LocalDate fromInclusive, LocalDate toInclusive) {
        String sql = """
            SELECT website_id, day_date, total_checks, successful_checks, failure_count,
                   timed_checks, avg_response_time_ms, min_response_time_ms, max_response_time_ms
            FROM monitoring_stats
            WHERE website_id = ? AND day_date BETWEEN ? AND ?
            ORDER BY day_date
            """;
        return jdbcTemplate.query(sql, new DailyStatRowMapper(),
                targetId, Date.valueOf(fromInclusive), Date.valueOf(toInclusive));
    }

    private static class DailyStatRowMapper implements RowMapper<DailyStat> {
        @Override
        public DailyStat mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DailyStat.builder()
                    .targetId(rs.getLong("website_id"))
                    .dayDate(rs.getDate("day_date").toLocalDate())
                    .totalChecks(rs.getInt("total_checks"))
                    .successfulChecks(rs.getInt("successful_checks"))
                    .failureCount(rs.getInt("failure_count"))
                    .timedChecks(rs.getInt("timed_checks"))
                    .avgResponseTimeMs(rs.getObject("avg_response_time_ms", Double.class))
                    .minResponseTimeMs(rs.getObject("min_response_time_ms", Double.class))
                    .maxResponseTimeMs(rs.getObject("max_response_time_ms", Double.class))
                    .build();
        }
    }
}
