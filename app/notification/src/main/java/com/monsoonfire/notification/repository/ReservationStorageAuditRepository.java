package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toInstant;
import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.model.StorageStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Append-only storage audit trail, trimmed to the newest entries per reservation. */
@Repository
@RequiredArgsConstructor
public class ReservationStorageAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void append(StorageAuditRecord record, int keepLatest) {
    final String insertSql =
        """
        INSERT INTO reservation_storage_audit (
          audit_id, reservation_id, uid, action, reason, from_status, to_status,
          reminder_ordinal, reminder_count, failure_code, at
        ) VALUES (
          :auditId, :reservationId, :uid, :action, :reason, :fromStatus, :toStatus,
          :reminderOrdinal, :reminderCount, :failureCode, :at
        )
        ON CONFLICT (audit_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("reservationId", record.reservationId())
            .addValue("uid", record.uid())
            .addValue("action", record.action())
            .addValue("reason", record.reason())
            .addValue("fromStatus", wire(record.fromStatus()))
            .addValue("toStatus", wire(record.toStatus()))
            .addValue("reminderOrdinal", record.reminderOrdinal())
            .addValue("reminderCount", record.reminderCount())
            .addValue("failureCode", record.failureCode())
            .addValue("at", toTimestamp(record.at()));
    jdbcTemplate.update(insertSql, params);

    final String trimSql =
        """
        DELETE FROM reservation_storage_audit
        WHERE reservation_id = :reservationId
          AND audit_id NOT IN (
            SELECT audit_id
            FROM reservation_storage_audit
            WHERE reservation_id = :reservationId
            ORDER BY at DESC, created_at DESC
            LIMIT :keepLatest
          )
        """;
    jdbcTemplate.update(
        trimSql,
        new MapSqlParameterSource()
            .addValue("reservationId", record.reservationId())
            .addValue("keepLatest", keepLatest));
  }

  public List<StorageAuditRecord> findByReservation(String reservationId) {
    final String sql =
        """
        SELECT audit_id, reservation_id, uid, action, reason, from_status, to_status,
               reminder_ordinal, reminder_count, failure_code, at
        FROM reservation_storage_audit
        WHERE reservation_id = :reservationId
        ORDER BY at, created_at
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("reservationId", reservationId), this::mapRow);
  }

  private static String wire(StorageStatus status) {
    return status == null ? null : status.wireName();
  }

  private StorageAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StorageAuditRecord(
        rs.getString("audit_id"),
        rs.getString("reservation_id"),
        rs.getString("uid"),
        rs.getString("action"),
        rs.getString("reason"),
        StorageStatus.fromWire(rs.getString("from_status")),
        StorageStatus.fromWire(rs.getString("to_status")),
        rs.getObject("reminder_ordinal", Integer.class),
        rs.getObject("reminder_count", Integer.class),
        rs.getString("failure_code"),
        toInstant(rs.getTimestamp("at")));
  }
}
