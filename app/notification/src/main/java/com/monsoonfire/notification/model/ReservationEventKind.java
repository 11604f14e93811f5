package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReservationEventKind {
  CONFIRMED,
  WAITLISTED,
  CANCELLED,
  ESTIMATE_SHIFT,
  PICKUP_READY,
  DELAY_FOLLOW_UP,
  PICKUP_REMINDER;

  @JsonValue
  public String wireName() {
    return WireValues.toWire(this);
  }

  @JsonCreator
  public static ReservationEventKind fromWire(String raw) {
    return WireValues.fromWire(ReservationEventKind.class, raw);
  }
}
