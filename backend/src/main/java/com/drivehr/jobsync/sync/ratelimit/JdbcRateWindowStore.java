package com.drivehr.jobsync.sync.ratelimit;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rate windows kept in {@code rate_limit_windows}, shared by every instance pointed at the same
 * database. The increment is a single conditional UPDATE so concurrent callers never push a window
 * past its limit.
 */
public class JdbcRateWindowStore implements RateWindowStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcRateWindowStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public boolean incrementIfBelow(String key, int limit, Duration ttl) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("clientKey", key)
            .addValue("limit", limit)
            .addValue("now", Timestamp.from(now))
            .addValue("expiresAt", Timestamp.from(now.plus(ttl)));

        if (incrementOpenWindow(params)) {
            return true;
        }
        if (hasOpenWindow(params)) {
            return false;
        }

        jdbc.update(
            """
                DELETE FROM rate_limit_windows
                WHERE client_key = :clientKey
                  AND expires_at <= :now
                """,
            params
        );
        try {
            jdbc.update(
                """
                    INSERT INTO rate_limit_windows (client_key, request_count, expires_at)
                    VALUES (:clientKey, 1, :expiresAt)
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            // another request opened the window first
            return incrementOpenWindow(params);
        }
    }

    @Override
    public int currentCount(String key) {
        List<Integer> counts = jdbc.query(
            """
                SELECT request_count
                FROM rate_limit_windows
                WHERE client_key = :clientKey
                  AND expires_at > :now
                """,
            new MapSqlParameterSource()
                .addValue("clientKey", key)
                .addValue("now", Timestamp.from(clock.instant())),
            (rs, rowNum) -> rs.getInt("request_count")
        );
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    private boolean incrementOpenWindow(MapSqlParameterSource params) {
        int updated = jdbc.update(
            """
                UPDATE rate_limit_windows
                SET request_count = request_count + 1
                WHERE client_key = :clientKey
                  AND expires_at > :now
                  AND request_count < :limit
                """,
            params
        );
        return updated == 1;
    }

    private boolean hasOpenWindow(MapSqlParameterSource params) {
        Integer open = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM rate_limit_windows
                WHERE client_key = :clientKey
                  AND expires_at > :now
                """,
            params,
            Integer.class
        );
        return open != null && open > 0;
    }
}
