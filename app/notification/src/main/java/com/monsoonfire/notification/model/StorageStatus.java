/*
 * Where: Notification model
 * What: Storage-policy status of a reservation waiting for pickup
 * Why: The rank orders the escalation so the sweep can keep the status moving forward only
 */
package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StorageStatus {
  ACTIVE,
  REMINDER_PENDING,
  HOLD_PENDING,
  STORED_BY_POLICY;

  public int rank() {
    return ordinal();
  }

  public boolean isAfter(StorageStatus other) {
    return other == null || rank() > other.rank();
  }

  public static StorageStatus max(StorageStatus left, StorageStatus right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return left.rank() >= right.rank() ? left : right;
  }

  @JsonValue
  public String wireName() {
    return WireValues.toWire(this);
  }

  @JsonCreator
  public static StorageStatus fromWire(String raw) {
    return WireValues.fromWire(StorageStatus.class, raw);
  }
}
