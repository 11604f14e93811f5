package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.EstimatedWindow;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.ReservationSnapshot;
import java.time.Instant;

/** Payload fields shared by every reservation job. */
public final class ReservationPayloads {

  private ReservationPayloads() {}

  /**
   * Identity, status and estimate fields of {@code after}; the previous-* fields come from
   * {@code before} when it is known.
   */
  public static NotificationPayload.NotificationPayloadBuilder base(
      ReservationSnapshot before, ReservationSnapshot after) {
    final EstimatedWindow current = after.estimatedWindow();
    final NotificationPayload.NotificationPayloadBuilder builder =
        NotificationPayload.builder()
            .firingId(after.reservationId())
            .reservationId(after.reservationId())
            .reservationStatus(after.normalizedStatus())
            .reservationLoadStatus(after.loadStatus())
            .estimateWindowLabel(estimateWindowLabel(current))
            .currentWindowStartIso(iso(current.currentStart()))
            .currentWindowEndIso(iso(current.currentEnd()));
    if (before != null) {
      builder
          .previousReservationStatus(before.normalizedStatus())
          .previousReservationLoadStatus(before.loadStatus())
          .previousWindowStartIso(iso(before.estimatedWindow().currentStart()))
          .previousWindowEndIso(iso(before.estimatedWindow().currentEnd()));
    }
    return builder;
  }

  public static String estimateWindowLabel(EstimatedWindow window) {
    final String start = iso(window.currentStart());
    final String end = iso(window.currentEnd());
    if (start != null && end != null) {
      return start + " -> " + end;
    }
    if (start != null) {
      return "from " + start;
    }
    if (end != null) {
      return "until " + end;
    }
    return null;
  }

  public static String iso(Instant value) {
    return value == null ? null : value.toString();
  }
}
