package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.InAppNotification;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class InAppNotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** False means the notification already exists, which callers treat as delivered. */
  public boolean insertIfAbsent(InAppNotification notification) {
    final String sql =
        """
        INSERT INTO in_app_notifications (
          notification_id, uid, type, title, body, data_json, created_at
        ) VALUES (
          :notificationId, :uid, :type, :title, :body, :dataJson::jsonb, :createdAt
        )
        ON CONFLICT (notification_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notification.notificationId())
            .addValue("uid", notification.uid())
            .addValue("type", notification.type())
            .addValue("title", notification.title())
            .addValue("body", notification.body())
            .addValue("dataJson", JsonColumns.write(objectMapper, notification.data()))
            .addValue("createdAt", toTimestamp(notification.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }
}
