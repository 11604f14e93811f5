package com.monsoonfire.notification.model;

import java.util.Optional;

/** Channels a reservation job may use, combining preferences with the reservation opt-in flag. */
public record ReservationRouting(NotificationPreferences preferences, boolean notifyReservations) {

  public DeliveryChannels channels() {
    return preferences.channels();
  }

  public Optional<SkipReason> skipReason() {
    if (!notifyReservations) {
      return Optional.of(SkipReason.RESERVATION_PREF_DISABLED);
    }
    if (!preferences.enabled()) {
      return Optional.of(SkipReason.PREFS_DISABLED);
    }
    if (!preferences.channels().hasAny()) {
      return Optional.of(SkipReason.NO_CHANNELS_ENABLED);
    }
    return Optional.empty();
  }
}
