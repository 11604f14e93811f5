package com.monsoonfire.notification.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/** Telemetry row for one SMS or push send. */
@Builder
public record DeliveryAttempt(
    String attemptId,
    String uid,
    String channel,
    NotificationJobType jobType,
    String dedupeKey,
    String reservationId,
    String firingId,
    String status,
    String reason,
    String provider,
    String providerCode,
    String phoneHash,
    List<String> tokenHashes,
    Integer accepted,
    Integer rejected,
    String fallbackChannel,
    String fallbackStatus,
    Instant createdAt) {

  public DeliveryAttempt {
    tokenHashes = tokenHashes == null ? List.of() : List.copyOf(tokenHashes);
  }
}
