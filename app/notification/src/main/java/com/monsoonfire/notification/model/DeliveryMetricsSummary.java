package com.monsoonfire.notification.model;

import java.time.Instant;
import java.util.Map;

public record DeliveryMetricsSummary(
    String snapshotId,
    int windowHours,
    int totalAttempts,
    Map<String, Integer> statusCounts,
    Map<String, Integer> reasonCounts,
    Map<String, Integer> providerCounts,
    String triggerMode,
    String triggeredBy,
    Instant computedAt) {

  public DeliveryMetricsSummary {
    statusCounts = Map.copyOf(statusCounts);
    reasonCounts = Map.copyOf(reasonCounts);
    providerCounts = Map.copyOf(providerCounts);
  }
}
