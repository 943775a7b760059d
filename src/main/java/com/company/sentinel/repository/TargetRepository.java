package com.company.sentinel.repository;

import com.company.sentinel.domain.TargetConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;

/**
 * Monitored endpoints in website_configs. The url is the natural key.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class TargetRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Insert or refresh a target by url
     *
     * @return the stored id
     */
    public long upsert(TargetConfig target) {
        String sql = """
            INSERT INTO website_configs (url, check_interval_seconds, regex_pattern, method, is_active)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (url) DO UPDATE SET
                check_interval_seconds = EXCLUDED.check_interval_seconds,
                regex_pattern = EXCLUDED.regex_pattern,
                method = EXCLUDED.method,
                is_active = EXCLUDED.is_active,
                updated_at = NOW()
            RETURNING id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
                target.getUrl(),
                target.getIntervalSeconds(),
                target.getRegexPattern(),
                target.getMethod().name(),
                target.isActive()
        );
        if (id == null) {
            throw new IllegalStateException("No id returned registering " + target.getUrl());
        }
        log.debug("Registered target {} as id {}", target.getUrl(), id);
        return id;
    }

    /**
     * Mark every stored target missing from the current configuration inactive
     */
    public int deactivateAllExcept(Collection<Long> keptIds) {
        if (keptIds.isEmpty()) {
            return jdbcTemplate.update("UPDATE website_configs SET is_active = FALSE, updated_at = NOW() WHERE is_active");
        }
        String placeholders = String.join(",", Collections.nCopies(keptIds.size(), "?"));
        return jdbcTemplate.update(String.format(
                "UPDATE website_configs SET is_active = FALSE, updated_at = NOW() WHERE is_active AND id NOT IN (%s)",
                placeholders), keptIds.toArray());
    }
}
