package com.monsoonfire.notification.service.event;

import com.monsoonfire.common.event.ReservationDocument;
import com.monsoonfire.common.event.ReservationDocument.EstimatedWindowDocument;
import com.monsoonfire.common.event.ReservationDocument.PickupWindowDocument;
import com.monsoonfire.notification.model.EstimatedWindow;
import com.monsoonfire.notification.model.PickupWindow;
import com.monsoonfire.notification.model.PickupWindowStatus;
import com.monsoonfire.notification.model.ReservationSnapshot;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/** Maps the raw reservation document of an event onto the reservation projection. */
final class ReservationDocumentMapper {

  private ReservationDocumentMapper() {}

  /** A missing document maps to an empty snapshot, so "before" of a create compares as unset. */
  static ReservationSnapshot toSnapshot(String reservationId, ReservationDocument document) {
    if (document == null) {
      return ReservationSnapshot.builder().reservationId(reservationId).build();
    }
    return ReservationSnapshot.builder()
        .reservationId(reservationId)
        .ownerUid(trimToNull(document.ownerUid()))
        .status(trimToNull(document.status()))
        .loadStatus(lower(document.loadStatus()))
        .createdAt(parseInstant("created_at", document.createdAt()))
        .updatedAt(parseInstant("updated_at", document.updatedAt()))
        .estimatedWindow(toWindow(document.estimatedWindow()))
        .stageReason(document.stageReason())
        .stageNotes(document.stageNotes())
        .staffNotes(document.staffNotes())
        .readyForPickupAt(parseInstant("ready_for_pickup_at", document.readyForPickupAt()))
        .pickupWindow(toPickupWindow(document.pickupWindow()))
        .build();
  }

  private static EstimatedWindow toWindow(EstimatedWindowDocument document) {
    if (document == null) {
      return EstimatedWindow.empty();
    }
    return new EstimatedWindow(
        parseInstant("estimated_window.current_start", document.currentStart()),
        parseInstant("estimated_window.current_end", document.currentEnd()),
        parseInstant("estimated_window.updated_at", document.updatedAt()),
        lower(document.slaState()),
        lower(document.confidence()));
  }

  private static PickupWindow toPickupWindow(PickupWindowDocument document) {
    if (document == null) {
      return PickupWindow.empty();
    }
    // unknown statuses map to null and never count as awaiting pickup
    final PickupWindowStatus status = PickupWindowStatus.fromWire(document.status());
    return new PickupWindow(
        parseInstant("pickup_window.requested_start", document.requestedStart()),
        parseInstant("pickup_window.requested_end", document.requestedEnd()),
        parseInstant("pickup_window.confirmed_start", document.confirmedStart()),
        parseInstant("pickup_window.confirmed_end", document.confirmedEnd()),
        status,
        parseInstant("pickup_window.confirmed_at", document.confirmedAt()),
        parseInstant("pickup_window.completed_at", document.completedAt()),
        document.missedCount() == null ? 0 : Math.max(0, document.missedCount()),
        document.rescheduleCount() == null ? 0 : Math.max(0, document.rescheduleCount()),
        null);
  }

  static Instant parseInstant(String field, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      // a malformed timestamp will not parse on redelivery either
      throw new NotificationEventPermanentException("invalid reservation " + field, ex);
    }
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String lower(String value) {
    final String trimmed = trimToNull(value);
    return trimmed == null ? null : trimmed.toLowerCase(Locale.ROOT);
  }
}
