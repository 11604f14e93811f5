/*
 * Where: Notification event handling
 * What: Turns a reservation before/after pair into reservation notification jobs
 * Why: Every job carries a dedupe key derived from the change, so redelivered or replayed events
 *      never notify twice
 */
package com.monsoonfire.notification.service.event;

import com.monsoonfire.common.event.ReservationEventPayload;
import com.monsoonfire.notification.config.DelayFollowUpProperties;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.PickupWindowStatus;
import com.monsoonfire.notification.model.ReservationEventKind;
import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageStatus;
import com.monsoonfire.notification.repository.ProcessedEventRepository;
import com.monsoonfire.notification.repository.ReservationRepository;
import com.monsoonfire.notification.service.DelayFollowUpChainer;
import com.monsoonfire.notification.service.NotificationContentBuilder;
import com.monsoonfire.notification.service.NotificationJobEnqueuer;
import com.monsoonfire.notification.service.NotificationScheduleResolver;
import com.monsoonfire.notification.service.ReservationPayloads;
import com.monsoonfire.notification.service.ReservationRoutingService;
import com.monsoonfire.notification.service.storage.PickupReadyService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ReservationEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(ReservationEventHandler.class);
  static final String EVENT_SOURCE = "reservation";
  private static final Set<String> NOTIFIED_STATUSES =
      Set.of("CONFIRMED", "WAITLISTED", "CANCELLED");
  private static final Set<String> ESTIMATE_STATUSES = Set.of("CONFIRMED", "WAITLISTED");
  private static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofHours(24);
  private static final Duration PRE_EXPIRY_LEAD = Duration.ofHours(24);

  private final ProcessedEventRepository processedEventRepository;
  private final ReservationRepository reservationRepository;
  private final ReservationRoutingService routingService;
  private final NotificationJobEnqueuer enqueuer;
  private final NotificationScheduleResolver scheduleResolver;
  private final DelayFollowUpChainer delayFollowUpChainer;
  private final PickupReadyService pickupReadyService;
  private final NotificationContentBuilder contentBuilder;
  private final DelayFollowUpProperties delayProperties;
  private final Clock clock;

  @Transactional
  public void handle(ReservationEventPayload event) {
    final String reservationId = requireText(event.reservationId(), "reservation_id");
    final String eventId = requireText(event.eventId(), "event_id");
    if (event.after() == null) {
      logger.debug("reservation event without document ignored reservationId={}", reservationId);
      return;
    }
    final Instant now = Instant.now(clock);
    // record the event id first so a redelivery finds it and stops here
    if (!processedEventRepository.insertIfAbsent(EVENT_SOURCE, eventId, now)) {
      logger.debug("reservation event already processed eventId={}", eventId);
      return;
    }

    final ReservationSnapshot before =
        ReservationDocumentMapper.toSnapshot(reservationId, event.before());
    final ReservationSnapshot after =
        ReservationDocumentMapper.toSnapshot(reservationId, event.after());
    reservationRepository.upsertFromEvent(after, now);

    final String uid = after.ownerUid();
    if (uid == null) {
      logger.warn(
          "reservation notification skipped: missing owner reservationId={}", reservationId);
      return;
    }
    final ReservationRouting routing = routingService.resolve(uid);
    final ReservationSnapshot stored = reservationRepository.findById(reservationId).orElse(after);
    final long updatedAtMs = (after.updatedAt() != null ? after.updatedAt() : now).toEpochMilli();

    enqueueStatusChange(uid, routing, before, after, updatedAtMs);
    enqueueEstimateShift(uid, routing, before, after, now);
    enqueuePickupWindowOpen(uid, routing, before, after, stored, updatedAtMs, now);
    handleBecameLoaded(uid, routing, before, after, stored, updatedAtMs, now);
  }

  private void enqueueStatusChange(
      String uid,
      ReservationRouting routing,
      ReservationSnapshot before,
      ReservationSnapshot after,
      long updatedAtMs) {
    final String status = after.normalizedStatus();
    if (Objects.equals(before.normalizedStatus(), status) || !NOTIFIED_STATUSES.contains(status)) {
      return;
    }
    final NotificationPayload payload =
        ReservationPayloads.base(before, after)
            .dedupeKey(
                "RESERVATION_STATUS:"
                    + after.reservationId()
                    + ":"
                    + (before.normalizedStatus() == null ? "unknown" : before.normalizedStatus())
                    + ":"
                    + status
                    + ":"
                    + updatedAtMs)
            .eventKind(ReservationEventKind.fromWire(status))
            .reason(after.reasonOr("Reservation moved to " + status + "."))
            .suggestedNextUpdateAtIso(
                after.isCancelled() ? null : suggestedUpdateIso(after, DEFAULT_UPDATE_INTERVAL))
            .build();
    enqueuer.enqueueReservationJob(
        NotificationJobType.RESERVATION_STATUS, uid, routing, payload, null);
  }

  private void enqueueEstimateShift(
      String uid,
      ReservationRouting routing,
      ReservationSnapshot before,
      ReservationSnapshot after,
      Instant now) {
    if (!ESTIMATE_STATUSES.contains(after.normalizedStatus())
        || !after.estimatedWindow().differsFrom(before.estimatedWindow())) {
      return;
    }
    final boolean delayed = after.estimatedWindow().isDelayed();
    final String episodeId = DelayFollowUpChainer.episodeIdFor(after, now);
    final NotificationPayload payload =
        ReservationPayloads.base(before, after)
            .dedupeKey(
                String.join(
                    ":",
                    "RESERVATION_ETA_SHIFT",
                    after.reservationId(),
                    orNull(ReservationPayloads.iso(before.estimatedWindow().currentStart())),
                    orNull(ReservationPayloads.iso(before.estimatedWindow().currentEnd())),
                    orNull(ReservationPayloads.iso(after.estimatedWindow().currentStart())),
                    orNull(ReservationPayloads.iso(after.estimatedWindow().currentEnd())),
                    after.estimatedWindow().slaState() == null
                        ? "unknown"
                        : after.estimatedWindow().slaState()))
            .eventKind(ReservationEventKind.ESTIMATE_SHIFT)
            .reason(
                after.reasonOr(
                    "Estimated firing window shifted based on live queue and kiln availability."))
            .suggestedNextUpdateAtIso(
                suggestedUpdateIso(
                    after, delayed ? delayProperties.initialDelay() : DEFAULT_UPDATE_INTERVAL))
            .delayEpisodeId(episodeId)
            .build();
    enqueuer.enqueueReservationJob(
        NotificationJobType.RESERVATION_ETA_SHIFT, uid, routing, payload, null);
    if (delayed) {
      delayFollowUpChainer.startChain(routing, before, after, episodeId);
    }
  }

  private void enqueuePickupWindowOpen(
      String uid,
      ReservationRouting routing,
      ReservationSnapshot before,
      ReservationSnapshot after,
      ReservationSnapshot stored,
      long updatedAtMs,
      Instant now) {
    if (before.pickupWindow().status() == after.pickupWindow().status()
        || after.pickupWindow().status() != PickupWindowStatus.OPEN) {
      return;
    }
    final Instant confirmedEnd = after.pickupWindow().confirmedEnd();
    final String endIso = ReservationPayloads.iso(confirmedEnd);
    final String endLabel = contentBuilder.formatForUser(endIso);
    final NotificationPayload openPayload =
        pickupBase(before, after, stored, now)
            .dedupeKey(
                "RESERVATION_PICKUP_WINDOW_OPEN:" + after.reservationId() + ":" + updatedAtMs)
            .reason(
                after.reasonOr(
                    "Pickup window is now open. Please confirm your collection window."))
            .policyWindowLabel(
                endLabel != null
                    ? "Pickup window closes around " + endLabel + "."
                    : "Pickup window is open. Confirm as soon as possible.")
            .suggestedNextUpdateAtIso(endIso)
            .build();
    enqueuer.enqueueReservationJob(
        NotificationJobType.RESERVATION_PICKUP_REMINDER, uid, routing, openPayload, null);

    if (confirmedEnd == null) {
      return;
    }
    final Instant preExpiry = confirmedEnd.minus(PRE_EXPIRY_LEAD);
    if (!preExpiry.isAfter(now)) {
      return;
    }
    final Instant runAfter = scheduleResolver.resolveRunAfter(preExpiry, routing.preferences());
    final NotificationPayload preExpiryPayload =
        pickupBase(before, after, stored, now)
            .dedupeKey(
                "RESERVATION_PICKUP_WINDOW_PRE_EXPIRY:"
                    + after.reservationId()
                    + ":"
                    + confirmedEnd.toEpochMilli())
            .reason(
                after.reasonOr(
                    "Pickup window reminder: your selected collection window is closing soon."))
            .policyWindowLabel("Pickup window closes in about 24 hours.")
            .suggestedNextUpdateAtIso(ReservationPayloads.iso(runAfter))
            .build();
    enqueuer.enqueueReservationJob(
        NotificationJobType.RESERVATION_PICKUP_REMINDER, uid, routing, preExpiryPayload, runAfter);
  }

  private void handleBecameLoaded(
      String uid,
      ReservationRouting routing,
      ReservationSnapshot before,
      ReservationSnapshot after,
      ReservationSnapshot stored,
      long updatedAtMs,
      Instant now) {
    final boolean becameLoaded =
        (after.isLoaded() && !before.isLoaded())
            || ("LOADED".equals(after.normalizedStatus())
                && !"LOADED".equals(before.normalizedStatus()));
    if (!becameLoaded) {
      return;
    }
    final String reason =
        after.reasonOr("Reservation load is complete and ready for pickup planning.");
    final Instant readyAt = readyForPickupAt(after, now);
    final NotificationPayload payload =
        ReservationPayloads.base(before, after)
            .dedupeKey("RESERVATION_READY_PICKUP:" + after.reservationId() + ":" + updatedAtMs)
            .eventKind(ReservationEventKind.PICKUP_READY)
            .reason(reason)
            .storageStatus(StorageStatus.ACTIVE)
            .previousStorageStatus(stored.currentStorageStatus())
            .reminderCount(0)
            .readyForPickupAtIso(ReservationPayloads.iso(readyAt))
            .policyWindowLabel("Pickup-ready notice sent. Storage reminders begin after 72 hours.")
            .build();
    enqueuer.enqueueReservationJob(
        NotificationJobType.RESERVATION_READY_PICKUP, uid, routing, payload, null);
    pickupReadyService.markReady(after.reservationId(), readyAt, reason);
  }

  private NotificationPayload.NotificationPayloadBuilder pickupBase(
      ReservationSnapshot before,
      ReservationSnapshot after,
      ReservationSnapshot stored,
      Instant now) {
    return ReservationPayloads.base(before, after)
        .eventKind(ReservationEventKind.PICKUP_REMINDER)
        .storageStatus(stored.currentStorageStatus())
        .previousStorageStatus(stored.currentStorageStatus())
        .reminderCount(stored.pickupReminderCount())
        .readyForPickupAtIso(ReservationPayloads.iso(readyForPickupAt(stored, now)));
  }

  /** Estimate update time, else the reservation's, plus the given interval. */
  private static String suggestedUpdateIso(ReservationSnapshot after, Duration interval) {
    final Instant anchor =
        after.estimatedWindow().updatedAt() != null
            ? after.estimatedWindow().updatedAt()
            : after.updatedAt();
    return anchor == null ? null : anchor.plus(interval).toString();
  }

  private static Instant readyForPickupAt(ReservationSnapshot reservation, Instant now) {
    if (reservation.readyForPickupAt() != null) {
      return reservation.readyForPickupAt();
    }
    return reservation.updatedAt() != null ? reservation.updatedAt() : now;
  }

  private static String orNull(String value) {
    return value == null ? "null" : value;
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new NotificationEventPermanentException("missing reservation event " + field);
    }
    return value.trim();
  }
}
