/*
 * Where: Notification data access
 * What: Records inbound event ids per source
 * Why: JetStream redelivers, so handlers only act on the first delivery of an event id
 */
package com.monsoonfire.notification.repository;

import java.time.Instant;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;

import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /** Returns false when the event id was already recorded for the source. */
    public boolean insertIfAbsent(String source, String eventId, Instant processedAt) {
        String sql = """
                INSERT INTO processed_events (event_id, source, processed_at)
                VALUES (:eventId, :source, :processedAt)
                ON CONFLICT (event_id) DO NOTHING
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("eventId", source + ":" + eventId)
                .addValue("source", source)
                .addValue("processedAt", toTimestamp(processedAt));
        return jdbcTemplate.update(sql, params) > 0;
    }

    public int deleteOlderThan(Instant threshold) {
        String sql = """
                DELETE FROM processed_events
                WHERE processed_at < :threshold
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("threshold", toTimestamp(threshold));
        return jdbcTemplate.update(sql, params);
    }
}
