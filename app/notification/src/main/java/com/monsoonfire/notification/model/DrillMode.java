package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Synthetic failure injected into push and SMS sends by the operator failure drill. */
public enum DrillMode {
  AUTH,
  PROVIDER_4XX,
  PROVIDER_5XX,
  NETWORK,
  SUCCESS;

  @JsonValue
  public String wireName() {
    return WireValues.toWire(this);
  }

  @JsonCreator
  public static DrillMode fromWire(String raw) {
    return WireValues.fromWire(DrillMode.class, raw);
  }
}
