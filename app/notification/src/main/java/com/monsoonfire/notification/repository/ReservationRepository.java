/*
 * Where: Notification data access
 * What: Reservation projection used by the event handler and the storage-policy sweep
 * Why: Reservation fields come from events; storage-policy fields are owned here and only
 *      written under a row lock
 */
package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toInstant;
import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.EstimatedWindow;
import com.monsoonfire.notification.model.PickupWindow;
import com.monsoonfire.notification.model.PickupWindowStatus;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageNoticeEntry;
import com.monsoonfire.notification.model.StorageStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReservationRepository {

  private static final TypeReference<List<StorageNoticeEntry>> HISTORY_TYPE =
      new TypeReference<>() {};

  private static final String COLUMNS =
      """
      reservation_id, owner_uid, status, load_status, created_at, updated_at,
      est_current_start, est_current_end, est_updated_at, est_sla_state, est_confidence,
      stage_reason, stage_notes, staff_notes, storage_status, ready_for_pickup_at,
      pickup_reminder_count, last_reminder_at, pickup_reminder_failure_count,
      last_reminder_failure_at, storage_notice_history::text AS storage_notice_history_text,
      pw_requested_start, pw_requested_end, pw_confirmed_start, pw_confirmed_end, pw_status,
      pw_confirmed_at, pw_completed_at, pw_missed_count, pw_reschedule_count, pw_last_missed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /**
   * Inserts or refreshes the event-owned fields. Storage-policy columns keep their stored values
   * on update; a later pickup-ready reset or sweep writes them. A window the sweep marked missed
   * stays missed until the event carries a different confirmed end.
   */
  public void upsertFromEvent(ReservationSnapshot reservation, Instant now) {
    final String sql =
        """
        INSERT INTO reservations (
          reservation_id, owner_uid, status, load_status, created_at, updated_at,
          est_current_start, est_current_end, est_updated_at, est_sla_state, est_confidence,
          stage_reason, stage_notes, staff_notes, ready_for_pickup_at,
          pw_requested_start, pw_requested_end, pw_confirmed_start, pw_confirmed_end, pw_status,
          pw_confirmed_at, pw_completed_at, pw_missed_count, pw_reschedule_count, row_updated_at
        ) VALUES (
          :reservationId, :ownerUid, :status, :loadStatus, :createdAt, :updatedAt,
          :estStart, :estEnd, :estUpdatedAt, :estSlaState, :estConfidence,
          :stageReason, :stageNotes, :staffNotes, :readyForPickupAt,
          :pwRequestedStart, :pwRequestedEnd, :pwConfirmedStart, :pwConfirmedEnd, :pwStatus,
          :pwConfirmedAt, :pwCompletedAt, :pwMissedCount, :pwRescheduleCount, :now
        )
        ON CONFLICT (reservation_id) DO UPDATE
        SET owner_uid = EXCLUDED.owner_uid,
            status = EXCLUDED.status,
            load_status = EXCLUDED.load_status,
            created_at = EXCLUDED.created_at,
            updated_at = EXCLUDED.updated_at,
            est_current_start = EXCLUDED.est_current_start,
            est_current_end = EXCLUDED.est_current_end,
            est_updated_at = EXCLUDED.est_updated_at,
            est_sla_state = EXCLUDED.est_sla_state,
            est_confidence = EXCLUDED.est_confidence,
            stage_reason = EXCLUDED.stage_reason,
            stage_notes = EXCLUDED.stage_notes,
            staff_notes = EXCLUDED.staff_notes,
            ready_for_pickup_at =
              COALESCE(EXCLUDED.ready_for_pickup_at, reservations.ready_for_pickup_at),
            pw_requested_start = EXCLUDED.pw_requested_start,
            pw_requested_end = EXCLUDED.pw_requested_end,
            pw_confirmed_start = EXCLUDED.pw_confirmed_start,
            pw_confirmed_end = EXCLUDED.pw_confirmed_end,
            pw_status = CASE
              WHEN reservations.pw_status = 'missed'
                AND EXCLUDED.pw_status IN ('open', 'confirmed')
                AND EXCLUDED.pw_confirmed_end IS NOT DISTINCT FROM reservations.pw_confirmed_end
              THEN reservations.pw_status
              ELSE EXCLUDED.pw_status
            END,
            pw_confirmed_at = EXCLUDED.pw_confirmed_at,
            pw_completed_at = EXCLUDED.pw_completed_at,
            pw_missed_count = GREATEST(EXCLUDED.pw_missed_count, reservations.pw_missed_count),
            pw_reschedule_count = EXCLUDED.pw_reschedule_count,
            row_updated_at = EXCLUDED.row_updated_at
        """;
    final EstimatedWindow window = reservation.estimatedWindow();
    final PickupWindow pickup = reservation.pickupWindow();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reservationId", reservation.reservationId())
            .addValue("ownerUid", reservation.ownerUid())
            .addValue("status", reservation.normalizedStatus())
            .addValue("loadStatus", reservation.loadStatus())
            .addValue("createdAt", toTimestamp(reservation.createdAt()))
            .addValue("updatedAt", toTimestamp(reservation.updatedAt()))
            .addValue("estStart", toTimestamp(window.currentStart()))
            .addValue("estEnd", toTimestamp(window.currentEnd()))
            .addValue("estUpdatedAt", toTimestamp(window.updatedAt()))
            .addValue("estSlaState", window.slaState())
            .addValue("estConfidence", window.confidence())
            .addValue("stageReason", reservation.stageReason())
            .addValue("stageNotes", reservation.stageNotes())
            .addValue("staffNotes", reservation.staffNotes())
            .addValue("readyForPickupAt", toTimestamp(reservation.readyForPickupAt()))
            .addValue("pwRequestedStart", toTimestamp(pickup.requestedStart()))
            .addValue("pwRequestedEnd", toTimestamp(pickup.requestedEnd()))
            .addValue("pwConfirmedStart", toTimestamp(pickup.confirmedStart()))
            .addValue("pwConfirmedEnd", toTimestamp(pickup.confirmedEnd()))
            .addValue("pwStatus", pickup.status() == null ? null : pickup.status().wireName())
            .addValue("pwConfirmedAt", toTimestamp(pickup.confirmedAt()))
            .addValue("pwCompletedAt", toTimestamp(pickup.completedAt()))
            .addValue("pwMissedCount", pickup.missedCount())
            .addValue("pwRescheduleCount", pickup.rescheduleCount())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public Optional<ReservationSnapshot> findById(String reservationId) {
    final String sql = "SELECT " + COLUMNS + " FROM reservations WHERE reservation_id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", reservationId), this::mapRow)
        .stream()
        .findFirst();
  }

  /** Must run inside a transaction; the row stays locked until it commits. */
  public Optional<ReservationSnapshot> findByIdForUpdate(String reservationId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM reservations WHERE reservation_id = :id FOR UPDATE";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", reservationId), this::mapRow)
        .stream()
        .findFirst();
  }

  /**
   * Loaded, not cancelled, pickup not completed; oldest anchor first. Rows already stored by
   * policy have no further sweep transition and would otherwise hold the oldest slots forever.
   */
  public List<String> findStorageSweepCandidates(int limit) {
    final String sql =
        """
        SELECT reservation_id
        FROM reservations
        WHERE load_status = 'loaded'
          AND COALESCE(status, '') <> 'CANCELLED'
          AND COALESCE(pw_status, '') <> 'completed'
          AND COALESCE(storage_status, 'active') <> 'stored_by_policy'
        ORDER BY COALESCE(ready_for_pickup_at, updated_at, created_at) NULLS FIRST
        LIMIT :limit
        """;
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource("limit", limit), String.class);
  }

  /** Writes every storage-policy owned column from the snapshot. */
  public int updateStorageState(ReservationSnapshot reservation, Instant now) {
    final String sql =
        """
        UPDATE reservations
        SET storage_status = :storageStatus,
            ready_for_pickup_at = :readyForPickupAt,
            pickup_reminder_count = :reminderCount,
            last_reminder_at = :lastReminderAt,
            pickup_reminder_failure_count = :failureCount,
            last_reminder_failure_at = :lastFailureAt,
            storage_notice_history = :historyJson::jsonb,
            pw_status = :pwStatus,
            pw_missed_count = :pwMissedCount,
            pw_last_missed_at = :pwLastMissedAt,
            row_updated_at = :now
        WHERE reservation_id = :reservationId
        """;
    final PickupWindow pickup = reservation.pickupWindow();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reservationId", reservation.reservationId())
            .addValue(
                "storageStatus",
                reservation.storageStatus() == null ? null : reservation.storageStatus().wireName())
            .addValue("readyForPickupAt", toTimestamp(reservation.readyForPickupAt()))
            .addValue("reminderCount", reservation.pickupReminderCount())
            .addValue("lastReminderAt", toTimestamp(reservation.lastReminderAt()))
            .addValue("failureCount", reservation.pickupReminderFailureCount())
            .addValue("lastFailureAt", toTimestamp(reservation.lastReminderFailureAt()))
            .addValue(
                "historyJson",
                JsonColumns.write(objectMapper, reservation.storageNoticeHistory()))
            .addValue("pwStatus", pickup.status() == null ? null : pickup.status().wireName())
            .addValue("pwMissedCount", pickup.missedCount())
            .addValue("pwLastMissedAt", toTimestamp(pickup.lastMissedAt()))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private ReservationSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String historyJson = rs.getString("storage_notice_history_text");
    return ReservationSnapshot.builder()
        .reservationId(rs.getString("reservation_id"))
        .ownerUid(rs.getString("owner_uid"))
        .status(rs.getString("status"))
        .loadStatus(rs.getString("load_status"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .estimatedWindow(
            new EstimatedWindow(
                toInstant(rs.getTimestamp("est_current_start")),
                toInstant(rs.getTimestamp("est_current_end")),
                toInstant(rs.getTimestamp("est_updated_at")),
                rs.getString("est_sla_state"),
                rs.getString("est_confidence")))
        .stageReason(rs.getString("stage_reason"))
        .stageNotes(rs.getString("stage_notes"))
        .staffNotes(rs.getString("staff_notes"))
        .storageStatus(StorageStatus.fromWire(rs.getString("storage_status")))
        .readyForPickupAt(toInstant(rs.getTimestamp("ready_for_pickup_at")))
        .pickupReminderCount(rs.getInt("pickup_reminder_count"))
        .lastReminderAt(toInstant(rs.getTimestamp("last_reminder_at")))
        .pickupReminderFailureCount(rs.getInt("pickup_reminder_failure_count"))
        .lastReminderFailureAt(toInstant(rs.getTimestamp("last_reminder_failure_at")))
        .storageNoticeHistory(
            historyJson == null
                ? List.of()
                : JsonColumns.read(objectMapper, historyJson, HISTORY_TYPE))
        .pickupWindow(
            new PickupWindow(
                toInstant(rs.getTimestamp("pw_requested_start")),
                toInstant(rs.getTimestamp("pw_requested_end")),
                toInstant(rs.getTimestamp("pw_confirmed_start")),
                toInstant(rs.getTimestamp("pw_confirmed_end")),
                PickupWindowStatus.fromWire(rs.getString("pw_status")),
                toInstant(rs.getTimestamp("pw_confirmed_at")),
                toInstant(rs.getTimestamp("pw_completed_at")),
                rs.getInt("pw_missed_count"),
                rs.getInt("pw_reschedule_count"),
                toInstant(rs.getTimestamp("pw_last_missed_at"))))
        .build();
  }
}
