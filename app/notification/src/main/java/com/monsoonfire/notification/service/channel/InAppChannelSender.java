package com.monsoonfire.notification.service.channel;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.model.InAppNotification;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.repository.InAppNotificationRepository;
import com.monsoonfire.notification.service.NotificationContent;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes the in-app notification keyed by sha256(dedupeKey); an existing row counts as sent. */
@Component
@RequiredArgsConstructor
public class InAppChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(InAppChannelSender.class);

  private final InAppNotificationRepository repository;
  private final Clock clock;

  public boolean send(NotificationJob job, NotificationContent content) {
    final Map<String, Object> data = new LinkedHashMap<>(content.data());
    data.put("dedupeKey", job.dedupeKey());
    data.put("sourceKind", content.sourceKind());
    if (content.sourceId() != null) {
      data.put("sourceId", content.sourceId());
    }
    final boolean created =
        repository.insertIfAbsent(
            new InAppNotification(
                DedupeHashes.sha256Hex(job.dedupeKey()),
                job.uid(),
                content.messageType(),
                content.title(),
                content.body(),
                data,
                Instant.now(clock)));
    if (!created) {
      logger.debug("in-app notification already exists jobId={}", job.jobId());
    }
    return created;
  }
}
