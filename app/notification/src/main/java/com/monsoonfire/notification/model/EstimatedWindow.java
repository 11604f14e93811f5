package com.monsoonfire.notification.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record EstimatedWindow(
    Instant currentStart,
    Instant currentEnd,
    Instant updatedAt,
    String slaState,
    String confidence) {

  public static EstimatedWindow empty() {
    return new EstimatedWindow(null, null, null, null, null);
  }

  public boolean isDelayed() {
    return slaState != null && "delayed".equals(slaState.trim().toLowerCase(Locale.ROOT));
  }

  public boolean differsFrom(EstimatedWindow other) {
    if (other == null) {
      return true;
    }
    return !Objects.equals(currentStart, other.currentStart)
        || !Objects.equals(currentEnd, other.currentEnd)
        || !Objects.equals(slaState, other.slaState)
        || !Objects.equals(confidence, other.confidence);
  }
}
