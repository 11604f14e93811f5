/*
 * Where: Notification model
 * What: Per-user notification preferences and their defaults
 * Why: Missing stored values fall back to the same defaults on every read
 */
package com.monsoonfire.notification.model;

import java.util.Locale;

public record NotificationPreferences(
    boolean enabled,
    DeliveryChannels channels,
    EventToggles events,
    QuietHours quietHours,
    Frequency frequency) {

  public static final String DEFAULT_TIMEZONE = "America/Phoenix";

  public static NotificationPreferences defaults() {
    return new NotificationPreferences(
        true,
        DeliveryChannels.inAppOnly(),
        new EventToggles(true, true, true),
        QuietHours.disabled(),
        new Frequency(FrequencyMode.IMMEDIATE, 6));
  }

  /** Kiln-unload events are additionally gated by the firing type toggle. */
  public boolean allowsKilnUnload(String firingType) {
    if (!enabled || !events.kilnUnloaded()) {
      return false;
    }
    final String normalized = firingType == null ? "" : firingType.toLowerCase(Locale.ROOT);
    if ("bisque".equals(normalized)) {
      return events.kilnUnloadedBisque();
    }
    if ("glaze".equals(normalized)) {
      return events.kilnUnloadedGlaze();
    }
    return true;
  }

  public record EventToggles(
      boolean kilnUnloaded, boolean kilnUnloadedBisque, boolean kilnUnloadedGlaze) {}

  public record QuietHours(boolean enabled, String startLocal, String endLocal, String timezone) {

    public static QuietHours disabled() {
      return new QuietHours(false, "21:00", "08:00", DEFAULT_TIMEZONE);
    }
  }

  public record Frequency(FrequencyMode mode, int digestHours) {}

  public enum FrequencyMode {
    IMMEDIATE,
    DIGEST
  }
}
