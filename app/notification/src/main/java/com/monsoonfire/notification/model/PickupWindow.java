package com.monsoonfire.notification.model;

import java.time.Instant;

public record PickupWindow(
    Instant requestedStart,
    Instant requestedEnd,
    Instant confirmedStart,
    Instant confirmedEnd,
    PickupWindowStatus status,
    Instant confirmedAt,
    Instant completedAt,
    int missedCount,
    int rescheduleCount,
    Instant lastMissedAt) {

  public static PickupWindow empty() {
    return new PickupWindow(null, null, null, null, null, null, null, 0, 0, null);
  }

  public PickupWindow markMissed(Instant now) {
    return new PickupWindow(
        requestedStart,
        requestedEnd,
        confirmedStart,
        confirmedEnd,
        PickupWindowStatus.MISSED,
        confirmedAt,
        completedAt,
        missedCount + 1,
        rescheduleCount,
        now);
  }
}
