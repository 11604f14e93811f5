package com.monsoonfire.notification.model;

import java.time.Instant;

/**
 * One unit of delivery work. The job id is the sha256 of the dedupe key, so creating the same key
 * twice resolves to the same row.
 */
public record NotificationJob(
    String jobId,
    String dedupeKey,
    NotificationJobType type,
    String uid,
    DeliveryChannels channels,
    NotificationPayload payload,
    JobStatus status,
    Instant runAfter,
    int attemptCount,
    String lastError,
    NotificationErrorClass lastErrorClass,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {

  public String reservationId() {
    return payload == null ? null : payload.reservationId();
  }
}
