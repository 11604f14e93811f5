/*
 * Where: Notification data access
 * What: Reads per-user notification preferences
 * Why: Rows are owned by profile management; absent rows and null columns resolve to defaults
 */
package com.monsoonfire.notification.repository;

import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.NotificationPreferences;
import com.monsoonfire.notification.model.NotificationPreferences.EventToggles;
import com.monsoonfire.notification.model.NotificationPreferences.Frequency;
import com.monsoonfire.notification.model.NotificationPreferences.FrequencyMode;
import com.monsoonfire.notification.model.NotificationPreferences.QuietHours;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationPreferencesRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public NotificationPreferences findByUid(String uid) {
    final String sql =
        """
        SELECT enabled, channel_in_app, channel_email, channel_push, channel_sms,
               event_kiln_unloaded, event_kiln_bisque, event_kiln_glaze,
               quiet_hours_enabled, quiet_hours_start, quiet_hours_end, quiet_hours_timezone,
               frequency_mode, digest_hours
        FROM notification_preferences
        WHERE uid = :uid
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("uid", uid), this::mapRow).stream()
        .findFirst()
        .orElseGet(NotificationPreferences::defaults);
  }

  private NotificationPreferences mapRow(ResultSet rs, int rowNum) throws SQLException {
    final NotificationPreferences defaults = NotificationPreferences.defaults();
    final DeliveryChannels defaultChannels = defaults.channels();
    final QuietHours defaultQuiet = defaults.quietHours();
    final Integer digestHours = rs.getObject("digest_hours", Integer.class);
    return new NotificationPreferences(
        bool(rs, "enabled", defaults.enabled()),
        new DeliveryChannels(
            bool(rs, "channel_in_app", defaultChannels.inApp()),
            bool(rs, "channel_email", defaultChannels.email()),
            bool(rs, "channel_push", defaultChannels.push()),
            bool(rs, "channel_sms", defaultChannels.sms())),
        new EventToggles(
            bool(rs, "event_kiln_unloaded", true),
            bool(rs, "event_kiln_bisque", true),
            bool(rs, "event_kiln_glaze", true)),
        new QuietHours(
            bool(rs, "quiet_hours_enabled", defaultQuiet.enabled()),
            text(rs, "quiet_hours_start", defaultQuiet.startLocal()),
            text(rs, "quiet_hours_end", defaultQuiet.endLocal()),
            text(rs, "quiet_hours_timezone", defaultQuiet.timezone())),
        new Frequency(
            "digest".equals(text(rs, "frequency_mode", "").toLowerCase(Locale.ROOT))
                ? FrequencyMode.DIGEST
                : FrequencyMode.IMMEDIATE,
            digestHours == null || digestHours <= 0
                ? defaults.frequency().digestHours()
                : digestHours));
  }

  private static boolean bool(ResultSet rs, String column, boolean fallback) throws SQLException {
    final Boolean value = rs.getObject(column, Boolean.class);
    return value == null ? fallback : value;
  }

  private static String text(ResultSet rs, String column, String fallback) throws SQLException {
    final String value = rs.getString(column);
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
