package com.monsoonfire.notification.service.channel;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.model.MailMessage;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.repository.MailQueueRepository;
import com.monsoonfire.notification.service.NotificationContent;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Queues the outbound mail document for the external mailer. Primary sends and SMS fallback share
 * one mail id, so a job produces at most one email.
 */
@Component
@RequiredArgsConstructor
public class EmailChannelSender {

  private final MailQueueRepository repository;
  private final Clock clock;

  public boolean send(NotificationJob job, NotificationContent content, String recipient) {
    final Map<String, Object> data = new LinkedHashMap<>(content.data());
    data.put("sourceKind", content.sourceKind());
    if (content.sourceId() != null) {
      data.put("sourceId", content.sourceId());
    }
    return repository.insertIfAbsent(
        new MailMessage(
            mailId(job.dedupeKey()),
            recipient,
            content.subject(),
            content.textBody(),
            data,
            Instant.now(clock)));
  }

  static String mailId(String dedupeKey) {
    return DedupeHashes.sha256Hex(dedupeKey + ":email");
  }
}
