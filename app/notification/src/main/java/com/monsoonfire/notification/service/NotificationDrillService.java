/*
 * Where: Notification service layer
 * What: Enqueues a synthetic kiln-unload job whose channel sends simulate a chosen failure
 * Why: Operators exercise retry, dead letter and alerting end to end without touching providers
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.DrillMode;
import com.monsoonfire.notification.model.NotificationJobSpec;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDrillService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDrillService.class);
  private static final Duration DEFERRED_DELAY = Duration.ofMinutes(2);

  private final NotificationJobEnqueuer enqueuer;
  private final Clock clock;

  public DrillTicket runDrill(
      String uid, DrillMode mode, DeliveryChannels channels, boolean forceRunNow) {
    if (uid == null || uid.isBlank()) {
      throw new IllegalArgumentException("uid is required");
    }
    if (mode == null) {
      throw new IllegalArgumentException("mode is required");
    }
    final Instant now = Instant.now(clock);
    final String drillId =
        "drill-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 6);
    final String dedupeKey = "DRILL:" + mode.wireName() + ":" + drillId + ":" + uid;
    final NotificationPayload payload =
        NotificationPayload.builder()
            .firingId("drill-firing-" + drillId)
            .kilnName("Drill Kiln")
            .firingType("bisque")
            .drillMode(mode)
            .build();
    final DeliveryChannels resolvedChannels =
        channels == null ? new DeliveryChannels(false, false, true, false) : channels;
    final Instant runAfter = forceRunNow ? now : now.plus(DEFERRED_DELAY);
    enqueuer.enqueue(
        NotificationJobSpec.queued(
            NotificationJobType.KILN_UNLOADED,
            uid.trim(),
            dedupeKey,
            resolvedChannels,
            payload,
            runAfter));
    logger.warn(
        "notification drill enqueued uid={} mode={} dedupeKey={} runAfter={}",
        uid,
        mode.wireName(),
        dedupeKey,
        runAfter);
    return new DrillTicket(drillId, dedupeKey, runAfter);
  }

  public record DrillTicket(String drillId, String dedupeKey, Instant runAfter) {}
}
