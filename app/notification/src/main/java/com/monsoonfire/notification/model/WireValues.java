package com.monsoonfire.notification.model;

import java.util.Locale;

/** Shared lower-case wire naming for enums persisted or exchanged as JSON. */
final class WireValues {

  private WireValues() {}

  static String toWire(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  static <E extends Enum<E>> E fromWire(Class<E> type, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    final String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (E candidate : type.getEnumConstants()) {
      if (candidate.name().equals(normalized)) {
        return candidate;
      }
    }
    return null;
  }
}
