package com.monsoonfire.notification.model;

import java.time.Instant;

/**
 * Request to create a job. A non-null {@code skipReason} creates the job directly in SKIPPED so the
 * decision stays visible on the read surface.
 */
public record NotificationJobSpec(
    NotificationJobType type,
    String uid,
    String dedupeKey,
    DeliveryChannels channels,
    NotificationPayload payload,
    Instant runAfter,
    SkipReason skipReason) {

  public static NotificationJobSpec queued(
      NotificationJobType type,
      String uid,
      String dedupeKey,
      DeliveryChannels channels,
      NotificationPayload payload,
      Instant runAfter) {
    return new NotificationJobSpec(type, uid, dedupeKey, channels, payload, runAfter, null);
  }

  public static NotificationJobSpec skipped(
      NotificationJobType type,
      String uid,
      String dedupeKey,
      NotificationPayload payload,
      SkipReason reason) {
    return new NotificationJobSpec(
        type, uid, dedupeKey, DeliveryChannels.none(), payload, null, reason);
  }
}
