package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toInstant;
import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.DeliveryMetricsSummary;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryMetricSnapshotRepository {

  private static final TypeReference<Map<String, Integer>> COUNTS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void save(DeliveryMetricsSummary summary) {
    final String sql =
        """
        INSERT INTO notification_metric_snapshots (
          snapshot_id, window_hours, total_attempts, status_counts, reason_counts,
          provider_counts, trigger_mode, triggered_by, computed_at
        ) VALUES (
          :snapshotId, :windowHours, :totalAttempts, :statusCounts::jsonb, :reasonCounts::jsonb,
          :providerCounts::jsonb, :triggerMode, :triggeredBy, :computedAt
        )
        ON CONFLICT (snapshot_id) DO UPDATE
        SET window_hours = EXCLUDED.window_hours,
            total_attempts = EXCLUDED.total_attempts,
            status_counts = EXCLUDED.status_counts,
            reason_counts = EXCLUDED.reason_counts,
            provider_counts = EXCLUDED.provider_counts,
            trigger_mode = EXCLUDED.trigger_mode,
            triggered_by = EXCLUDED.triggered_by,
            computed_at = EXCLUDED.computed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("snapshotId", summary.snapshotId())
            .addValue("windowHours", summary.windowHours())
            .addValue("totalAttempts", summary.totalAttempts())
            .addValue("statusCounts", JsonColumns.write(objectMapper, summary.statusCounts()))
            .addValue("reasonCounts", JsonColumns.write(objectMapper, summary.reasonCounts()))
            .addValue("providerCounts", JsonColumns.write(objectMapper, summary.providerCounts()))
            .addValue("triggerMode", summary.triggerMode())
            .addValue("triggeredBy", summary.triggeredBy())
            .addValue("computedAt", toTimestamp(summary.computedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<DeliveryMetricsSummary> findById(String snapshotId) {
    final String sql =
        """
        SELECT snapshot_id, window_hours, total_attempts,
               status_counts::text AS status_counts_text,
               reason_counts::text AS reason_counts_text,
               provider_counts::text AS provider_counts_text,
               trigger_mode, triggered_by, computed_at
        FROM notification_metric_snapshots
        WHERE snapshot_id = :snapshotId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("snapshotId", snapshotId), this::mapRow)
        .stream()
        .findFirst();
  }

  private DeliveryMetricsSummary mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryMetricsSummary(
        rs.getString("snapshot_id"),
        rs.getInt("window_hours"),
        rs.getInt("total_attempts"),
        JsonColumns.read(objectMapper, rs.getString("status_counts_text"), COUNTS_TYPE),
        JsonColumns.read(objectMapper, rs.getString("reason_counts_text"), COUNTS_TYPE),
        JsonColumns.read(objectMapper, rs.getString("provider_counts_text"), COUNTS_TYPE),
        rs.getString("trigger_mode"),
        rs.getString("triggered_by"),
        toInstant(rs.getTimestamp("computed_at")));
  }
}
