/*
 * Where: Notification data access
 * What: Registers, lists and deactivates push device tokens
 * Why: Tokens are keyed by the sha256 of the raw token so re-registration is an upsert
 */
package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toInstant;
import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.monsoonfire.notification.model.DeviceToken;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceTokenRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsertRegistration(DeviceToken token) {
    final String sql =
        """
        INSERT INTO device_tokens (
          token_hash, uid, token, platform, environment, active,
          app_version, app_build, device_model,
          created_at, updated_at, last_seen_at, deactivated_at, deactivation_reason
        ) VALUES (
          :tokenHash, :uid, :token, :platform, :environment, TRUE,
          :appVersion, :appBuild, :deviceModel,
          :now, :now, :now, NULL, NULL
        )
        ON CONFLICT (token_hash) DO UPDATE
        SET uid = EXCLUDED.uid,
            token = EXCLUDED.token,
            platform = EXCLUDED.platform,
            environment = EXCLUDED.environment,
            active = TRUE,
            app_version = EXCLUDED.app_version,
            app_build = EXCLUDED.app_build,
            device_model = EXCLUDED.device_model,
            updated_at = EXCLUDED.updated_at,
            last_seen_at = EXCLUDED.last_seen_at,
            deactivated_at = NULL,
            deactivation_reason = NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tokenHash", token.tokenHash())
            .addValue("uid", token.uid())
            .addValue("token", token.token())
            .addValue("platform", token.platform())
            .addValue("environment", token.environment())
            .addValue("appVersion", token.appVersion())
            .addValue("appBuild", token.appBuild())
            .addValue("deviceModel", token.deviceModel())
            .addValue("now", toTimestamp(token.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<DeviceToken> findActiveByUid(String uid, int limit) {
    final String sql =
        """
        SELECT token_hash, uid, token, platform, environment, active, app_version, app_build,
               device_model, created_at, updated_at, last_seen_at, deactivated_at,
               deactivation_reason
        FROM device_tokens
        WHERE uid = :uid
          AND active = TRUE
        ORDER BY updated_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("uid", uid).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Deactivates the user's own tokens; returns the number of rows changed. */
  public int deactivate(String uid, Collection<String> tokenHashes, String reason, Instant now) {
    if (tokenHashes.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE device_tokens
        SET active = FALSE,
            deactivated_at = :now,
            deactivation_reason = :reason,
            updated_at = :now
        WHERE uid = :uid
          AND token_hash IN (:tokenHashes)
          AND active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("uid", uid)
            .addValue("tokenHashes", tokenHashes)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int deactivateStale(Instant cutoff, int limit, String reason, Instant now) {
    final String sql =
        """
        UPDATE device_tokens
        SET active = FALSE,
            deactivated_at = :now,
            deactivation_reason = :reason,
            updated_at = :now
        WHERE token_hash IN (
          SELECT token_hash
          FROM device_tokens
          WHERE active = TRUE
            AND updated_at <= :cutoff
          ORDER BY updated_at
          LIMIT :limit
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("limit", limit)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private DeviceToken mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeviceToken(
        rs.getString("token_hash"),
        rs.getString("uid"),
        rs.getString("token"),
        rs.getString("platform"),
        rs.getString("environment"),
        rs.getBoolean("active"),
        rs.getString("app_version"),
        rs.getString("app_build"),
        rs.getString("device_model"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("last_seen_at")),
        toInstant(rs.getTimestamp("deactivated_at")),
        rs.getString("deactivation_reason"));
  }
}
