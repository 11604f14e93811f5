package com.monsoonfire.notification.repository;

import static com.monsoonfire.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.model.MailMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MailQueueRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public boolean insertIfAbsent(MailMessage message) {
    final String sql =
        """
        INSERT INTO mail_queue (mail_id, recipient, subject, text_body, data_json, created_at)
        VALUES (:mailId, :recipient, :subject, :textBody, :dataJson::jsonb, :createdAt)
        ON CONFLICT (mail_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("mailId", message.mailId())
            .addValue("recipient", message.recipient())
            .addValue("subject", message.subject())
            .addValue("textBody", message.textBody())
            .addValue("dataJson", JsonColumns.write(objectMapper, message.data()))
            .addValue("createdAt", toTimestamp(message.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }
}
