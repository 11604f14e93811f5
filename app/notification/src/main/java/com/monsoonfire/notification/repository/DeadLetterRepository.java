/*
 * Where: Notification data access
 * What: Writes and lists notification_dead_letters
 * Why: Jobs that exhausted retries are archived once, keyed by job id, for operator inspection
 */
package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toInstant;
import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.DeadLetterRecord;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public boolean insert(DeadLetterRecord record) {
    final String sql =
        """
        INSERT INTO notification_dead_letters (
          job_id, dedupe_key, uid, type, payload_json, channels_json,
          attempt_count, error_class, error_message, failed_at
        ) VALUES (
          :jobId, :dedupeKey, :uid, :type, :payloadJson::jsonb, :channelsJson::jsonb,
          :attemptCount, :errorClass, :errorMessage, :failedAt
        )
        ON CONFLICT (job_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("dedupeKey", record.dedupeKey())
            .addValue("uid", record.uid())
            .addValue("type", record.type().name())
            .addValue("payloadJson", JsonColumns.write(objectMapper, record.payload()))
            .addValue("channelsJson", JsonColumns.write(objectMapper, record.channels()))
            .addValue("attemptCount", record.attemptCount())
            .addValue("errorClass", record.errorClass().wireName())
            .addValue("errorMessage", record.errorMessage())
            .addValue("failedAt", toTimestamp(record.failedAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<DeadLetterRecord> findRecent(int limit) {
    final String sql =
        """
        SELECT job_id, dedupe_key, uid, type, payload_json::text AS payload_json_text,
               channels_json::text AS channels_json_text, attempt_count, error_class,
               error_message, failed_at
        FROM notification_dead_letters
        ORDER BY failed_at DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  public int countByJobId(String jobId) {
    final String sql = "SELECT COUNT(*) FROM notification_dead_letters WHERE job_id = :jobId";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("jobId", jobId), Integer.class);
    return count == null ? 0 : count;
  }

  private DeadLetterRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeadLetterRecord(
        rs.getString("job_id"),
        rs.getString("dedupe_key"),
        rs.getString("uid"),
        NotificationJobType.valueOf(rs.getString("type")),
        JsonColumns.read(
            objectMapper, rs.getString("payload_json_text"), NotificationPayload.class),
        JsonColumns.read(objectMapper, rs.getString("channels_json_text"), DeliveryChannels.class),
        rs.getInt("attempt_count"),
        NotificationErrorClass.fromWire(rs.getString("error_class")),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("failed_at")));
  }
}
