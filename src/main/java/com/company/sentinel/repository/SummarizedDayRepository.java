package com.company.sentinel.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Ledger of days whose raw results were folded into monitoring_stats
 */
@Repository
@RequiredArgsConstructor
public class SummarizedDayRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<LocalDate> findLastDay() {
        Date last = jdbcTemplate.queryForObject(
                "SELECT MAX(day_date) FROM retention_summarized_days", Date.class);
        return Optional.ofNullable(last).map(Date::toLocalDate);
    }

    /**
     * Claim a day in the ledger.
     *
     * @return false if the day was already recorded
     */
    public boolean markSummarized(LocalDate day, int targetCount) {
        int rows = jdbcTemplate.update("""
            INSERT INTO retention_summarized_days (day_date, targets_summarized, summarized_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (day_date) DO NOTHING
            """, Date.valueOf(day), targetCount);
        return rows > 0;
    }
}
