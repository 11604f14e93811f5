package com.monsoonfire.notification.service;

import java.util.Map;

/** Rendered copy of one job, shared by every channel. */
public record NotificationContent(
    String messageType,
    String title,
    String body,
    String subject,
    String textBody,
    String sourceKind,
    String sourceId,
    Map<String, Object> data) {

  public NotificationContent {
    data = Map.copyOf(data);
  }
}
