package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.DeliveryAttempt;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryAttemptRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** Attempt ids are derived from the outcome, so a repeated attempt overwrites its own row. */
  public void upsert(DeliveryAttempt attempt) {
    final String sql =
        """
        INSERT INTO notification_delivery_attempts (
          attempt_id, uid, channel, job_type, dedupe_key, reservation_id, firing_id, status,
          reason, provider, provider_code, phone_hash, token_hashes, accepted, rejected,
          fallback_channel, fallback_status, created_at
        ) VALUES (
          :attemptId, :uid, :channel, :jobType, :dedupeKey, :reservationId, :firingId, :status,
          :reason, :provider, :providerCode, :phoneHash, :tokenHashes::jsonb, :accepted, :rejected,
          :fallbackChannel, :fallbackStatus, :createdAt
        )
        ON CONFLICT (attempt_id) DO UPDATE
        SET status = EXCLUDED.status,
            reason = EXCLUDED.reason,
            provider_code = EXCLUDED.provider_code,
            accepted = EXCLUDED.accepted,
            rejected = EXCLUDED.rejected,
            fallback_channel = EXCLUDED.fallback_channel,
            fallback_status = EXCLUDED.fallback_status,
            created_at = EXCLUDED.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptId", attempt.attemptId())
            .addValue("uid", attempt.uid())
            .addValue("channel", attempt.channel())
            .addValue("jobType", attempt.jobType().name())
            .addValue("dedupeKey", attempt.dedupeKey())
            .addValue("reservationId", attempt.reservationId())
            .addValue("firingId", attempt.firingId())
            .addValue("status", attempt.status())
            .addValue("reason", attempt.reason())
            .addValue("provider", attempt.provider())
            .addValue("providerCode", attempt.providerCode())
            .addValue("phoneHash", attempt.phoneHash())
            .addValue("tokenHashes", JsonColumns.write(objectMapper, attempt.tokenHashes()))
            .addValue("accepted", attempt.accepted())
            .addValue("rejected", attempt.rejected())
            .addValue("fallbackChannel", attempt.fallbackChannel())
            .addValue("fallbackStatus", attempt.fallbackStatus())
            .addValue("createdAt", toTimestamp(attempt.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AttemptOutcomeRow> findOutcomesSince(Instant cutoff, int limit) {
    final String sql =
        """
        SELECT status, reason, provider
        FROM notification_delivery_attempts
        WHERE created_at >= :cutoff
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new AttemptOutcomeRow(
                rs.getString("status"), rs.getString("reason"), rs.getString("provider")));
  }

  /** Attempts feed the rolling outcome snapshot only, so rows past retention carry no reader. */
  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_delivery_attempts
        WHERE created_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  public record AttemptOutcomeRow(String status, String reason, String provider) {}
}
