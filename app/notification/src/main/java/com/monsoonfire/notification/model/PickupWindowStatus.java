package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PickupWindowStatus {
  OPEN,
  CONFIRMED,
  MISSED,
  EXPIRED,
  COMPLETED;

  /** A window that can still be missed by letting its confirmed end elapse. */
  public boolean isAwaitingPickup() {
    return this == OPEN || this == CONFIRMED;
  }

  @JsonValue
  public String wireName() {
    return WireValues.toWire(this);
  }

  @JsonCreator
  public static PickupWindowStatus fromWire(String raw) {
    return WireValues.fromWire(PickupWindowStatus.class, raw);
  }
}
