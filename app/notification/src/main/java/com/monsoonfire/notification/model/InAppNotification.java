package com.monsoonfire.notification.model;

import java.time.Instant;
import java.util.Map;

public record InAppNotification(
    String notificationId,
    String uid,
    String type,
    String title,
    String body,
    Map<String, Object> data,
    Instant createdAt) {}
