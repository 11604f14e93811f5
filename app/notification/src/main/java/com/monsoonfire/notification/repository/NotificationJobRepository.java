/*
 * Where: Notification data access
 * What: Creates, claims and transitions notification_jobs rows
 * Why: The job id is the dedupe hash, so creation is insert-if-absent and every transition is
 *      guarded by the expected status and lock owner
 */
package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toInstant;
import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.JobStatus;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
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
public class NotificationJobRepository {

  private static final String JOB_COLUMNS =
      """
      job_id, dedupe_key, type, uid, channel_in_app, channel_email, channel_push, channel_sms,
      payload_json::text AS payload_json_text, status, run_after, attempt_count, last_error,
      last_error_class, locked_by, lease_until, created_at, updated_at
      """;

  private static final String RETURNING_COLUMNS =
      """
      RETURNING j.job_id, j.dedupe_key, j.type, j.uid, j.channel_in_app, j.channel_email,
                j.channel_push, j.channel_sms, j.payload_json::text AS payload_json_text, j.status,
                j.run_after, j.attempt_count, j.last_error, j.last_error_class, j.locked_by,
                j.lease_until, j.created_at, j.updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** Returns true when the row was created, false when a job with the same id already exists. */
  public boolean insertIfAbsent(NotificationJob job) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          job_id, dedupe_key, type, uid,
          channel_in_app, channel_email, channel_push, channel_sms,
          payload_json, status, run_after, attempt_count, last_error, last_error_class,
          created_at, updated_at
        ) VALUES (
          :jobId, :dedupeKey, :type, :uid,
          :inApp, :email, :push, :sms,
          :payloadJson::jsonb, :status, :runAfter, 0, :lastError, NULL,
          :createdAt, :createdAt
        )
        ON CONFLICT DO NOTHING
        """;
    final DeliveryChannels channels = job.channels();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("dedupeKey", job.dedupeKey())
            .addValue("type", job.type().name())
            .addValue("uid", job.uid())
            .addValue("inApp", channels.inApp())
            .addValue("email", channels.email())
            .addValue("push", channels.push())
            .addValue("sms", channels.sms())
            .addValue("payloadJson", JsonColumns.write(objectMapper, job.payload()))
            .addValue("status", job.status().name())
            .addValue("runAfter", toTimestamp(job.runAfter()))
            .addValue("lastError", job.lastError())
            .addValue("createdAt", toTimestamp(job.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<NotificationJob> findById(String jobId) {
    final String sql = "SELECT " + JOB_COLUMNS + " FROM notification_jobs WHERE job_id = :jobId";
    final List<NotificationJob> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource("jobId", jobId), this::mapRow);
    return rows.stream().findFirst();
  }

  /**
   * Claims due QUEUED jobs plus PROCESSING jobs whose lease expired, incrementing the attempt
   * count in the same statement.
   */
  public List<NotificationJob> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM notification_jobs
          WHERE (
            status = 'QUEUED'
            AND (run_after IS NULL OR run_after <= :now)
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY run_after NULLS FIRST, created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs j
        SET status = 'PROCESSING',
            attempt_count = j.attempt_count + 1,
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE j.job_id = cte.job_id
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Claims one job for an immediate attempt; empty when it is not due or already taken. */
  public Optional<NotificationJob> claimById(
      String jobId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs j
        SET status = 'PROCESSING',
            attempt_count = j.attempt_count + 1,
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            updated_at = :now
        WHERE j.job_id = :jobId
          AND (
            (j.status = 'QUEUED' AND (j.run_after IS NULL OR j.run_after <= :now))
            OR (j.status = 'PROCESSING' AND (j.lease_until IS NULL OR j.lease_until <= :now))
          )
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Extends the lease of a job this claim still holds. Returns 0 once another claim has taken the
   * job over, in which case the caller must not dispatch it.
   */
  public int renewLease(String jobId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET lease_until = :leaseUntil,
            updated_at = :now
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markDone(String jobId, String warnings, Instant now, String lockedBy) {
    return finish(jobId, JobStatus.DONE, warnings, null, null, now, lockedBy);
  }

  public int markSkipped(String jobId, String reason, Instant now, String lockedBy) {
    return finish(jobId, JobStatus.SKIPPED, reason, null, null, now, lockedBy);
  }

  public int markRetry(
      String jobId,
      Instant runAfter,
      String lastError,
      NotificationErrorClass errorClass,
      Instant now,
      String lockedBy) {
    return finish(jobId, JobStatus.QUEUED, lastError, errorClass, runAfter, now, lockedBy);
  }

  public int markFailed(
      String jobId,
      String lastError,
      NotificationErrorClass errorClass,
      Instant now,
      String lockedBy) {
    return finish(jobId, JobStatus.FAILED, lastError, errorClass, null, now, lockedBy);
  }

  private int finish(
      String jobId,
      JobStatus nextStatus,
      String lastError,
      NotificationErrorClass errorClass,
      Instant runAfter,
      Instant now,
      String lockedBy) {
    // run_after only changes when re-queueing for a retry
    final String sql =
        """
        UPDATE notification_jobs
        SET status = :status,
            last_error = :lastError,
            last_error_class = COALESCE(:errorClass, last_error_class),
            run_after = COALESCE(:runAfter, run_after),
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", nextStatus.name())
            .addValue("lastError", lastError)
            .addValue("errorClass", errorClass == null ? null : errorClass.wireName())
            .addValue("runAfter", toTimestamp(runAfter))
            .addValue("now", toTimestamp(now))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int countDueQueued(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE status = 'QUEUED'
          AND (run_after IS NULL OR run_after <= :now)
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("now", toTimestamp(now)), Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_jobs
        WHERE updated_at < :threshold
          AND status IN ('DONE', 'SKIPPED', 'FAILED')
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE created_at < :threshold
          AND status IN ('QUEUED', 'PROCESSING')
          AND (run_after IS NULL OR run_after < :threshold)
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)), Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationJob(
        rs.getString("job_id"),
        rs.getString("dedupe_key"),
        NotificationJobType.valueOf(rs.getString("type")),
        rs.getString("uid"),
        new DeliveryChannels(
            rs.getBoolean("channel_in_app"),
            rs.getBoolean("channel_email"),
            rs.getBoolean("channel_push"),
            rs.getBoolean("channel_sms")),
        JsonColumns.read(
            objectMapper, rs.getString("payload_json_text"), NotificationPayload.class),
        JobStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("run_after")),
        rs.getInt("attempt_count"),
        rs.getString("last_error"),
        NotificationErrorClass.fromWire(rs.getString("last_error_class")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
