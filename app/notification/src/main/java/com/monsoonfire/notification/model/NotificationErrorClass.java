/*
 * Where: Notification model
 * What: Failure classes produced by the error classifier
 * Why: Retry decisions depend only on the class, never on channel-specific error shapes
 */
package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationErrorClass {
  AUTH,
  NETWORK,
  PROVIDER_4XX,
  PROVIDER_5XX,
  UNKNOWN;

  public boolean isRetryable() {
    return this == PROVIDER_5XX || this == NETWORK || this == UNKNOWN;
  }

  @JsonValue
  public String wireName() {
    return WireValues.toWire(this);
  }

  @JsonCreator
  public static NotificationErrorClass fromWire(String raw) {
    return WireValues.fromWire(NotificationErrorClass.class, raw);
  }
}
