package com.monsoonfire.notification.model;

/** Terminal reasons recorded in last_error for skipped jobs. */
public enum SkipReason {
  RESERVATION_PREF_DISABLED,
  PREFS_DISABLED,
  NO_CHANNELS_ENABLED,
  RESERVATION_ID_MISSING,
  RESERVATION_NOT_FOUND,
  RESERVATION_NO_LONGER_DELAYED,
  RESERVATION_NOT_READY_FOR_PICKUP,
  RESERVATION_STORAGE_FINALIZED,
  REMINDER_ALREADY_RECORDED
}
