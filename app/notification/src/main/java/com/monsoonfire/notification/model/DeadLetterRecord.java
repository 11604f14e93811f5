package com.monsoonfire.notification.model;

import java.time.Instant;

public record DeadLetterRecord(
    String jobId,
    String dedupeKey,
    String uid,
    NotificationJobType type,
    NotificationPayload payload,
    DeliveryChannels channels,
    int attemptCount,
    NotificationErrorClass errorClass,
    String errorMessage,
    Instant failedAt) {}
