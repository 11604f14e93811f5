/*
 * Where: Notification service layer
 * What: Computes the earliest dispatch time allowed by a user's frequency and quiet hours
 * Why: Digest delay applies first, then quiet hours defer the candidate to the window end
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.NotificationPreferences;
import com.monsoonfire.notification.model.NotificationPreferences.FrequencyMode;
import com.monsoonfire.notification.model.NotificationPreferences.QuietHours;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NotificationScheduleResolver {

  private static final Logger logger = LoggerFactory.getLogger(NotificationScheduleResolver.class);
  private static final int DEFAULT_START_MINUTES = 21 * 60;
  private static final int DEFAULT_END_MINUTES = 8 * 60;

  public Instant resolveRunAfter(Instant base, NotificationPreferences preferences) {
    Instant candidate = base;
    if (preferences.frequency().mode() == FrequencyMode.DIGEST) {
      candidate = candidate.plus(Duration.ofHours(preferences.frequency().digestHours()));
    }

    final QuietHours quiet = preferences.quietHours();
    if (quiet == null || !quiet.enabled()) {
      return candidate;
    }

    final ZonedDateTime local = candidate.atZone(resolveZone(quiet.timezone()));
    final int localMinutes = local.getHour() * 60 + local.getMinute();
    final int start = parseLocalMinutes(quiet.startLocal(), DEFAULT_START_MINUTES);
    final int end = parseLocalMinutes(quiet.endLocal(), DEFAULT_END_MINUTES);

    if (!isWithinQuietHours(localMinutes, start, end)) {
      return candidate;
    }

    // start == end is an always-quiet window; it resolves to the next occurrence of the boundary
    final LocalTime endTime = LocalTime.of(end / 60, end % 60);
    ZonedDateTime target = local.truncatedTo(ChronoUnit.DAYS).with(endTime);
    final boolean rollsToNextDay = start < end ? localMinutes >= end : localMinutes >= start;
    if (rollsToNextDay) {
      target = target.plusDays(1);
    }
    final Duration shift = Duration.between(local.truncatedTo(ChronoUnit.MINUTES), target);
    return candidate.truncatedTo(ChronoUnit.MINUTES).plus(shift);
  }

  static boolean isWithinQuietHours(int localMinutes, int startMinutes, int endMinutes) {
    if (startMinutes == endMinutes) {
      return true;
    }
    if (startMinutes < endMinutes) {
      return localMinutes >= startMinutes && localMinutes < endMinutes;
    }
    return localMinutes >= startMinutes || localMinutes < endMinutes;
  }

  /** Parses {@code HH:mm}, clamping hours to 0-23 and minutes to 0-59. */
  static int parseLocalMinutes(String raw, int fallback) {
    if (raw == null) {
      return fallback;
    }
    final String[] parts = raw.split(":");
    if (parts.length < 2) {
      return fallback;
    }
    try {
      final int hours = Math.min(23, Math.max(0, Integer.parseInt(parts[0].trim())));
      final int minutes = Math.min(59, Math.max(0, Integer.parseInt(parts[1].trim())));
      return hours * 60 + minutes;
    } catch (NumberFormatException ex) {
      return fallback;
    }
  }

  private ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return ZoneId.of(NotificationPreferences.DEFAULT_TIMEZONE);
    }
    try {
      return ZoneId.of(timezone.trim());
    } catch (DateTimeException ex) {
      logger.warn("invalid quiet hours timezone={}; using default", timezone, ex);
      return ZoneId.of(NotificationPreferences.DEFAULT_TIMEZONE);
    }
  }
}
