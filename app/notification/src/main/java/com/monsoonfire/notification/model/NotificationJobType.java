package com.monsoonfire.notification.model;

public enum NotificationJobType {
  KILN_UNLOADED,
  RESERVATION_STATUS,
  RESERVATION_ETA_SHIFT,
  RESERVATION_READY_PICKUP,
  RESERVATION_DELAY_FOLLOW_UP,
  RESERVATION_PICKUP_REMINDER;

  public boolean isReservationType() {
    return this != KILN_UNLOADED;
  }

  /** Follow-up and reminder jobs are re-validated against the live reservation before sending. */
  public boolean requiresLiveReservation() {
    return this == RESERVATION_DELAY_FOLLOW_UP || this == RESERVATION_PICKUP_REMINDER;
  }
}
