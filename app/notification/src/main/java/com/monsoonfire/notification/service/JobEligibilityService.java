/*
 * Where: Notification service layer
 * What: Dispatch-time gate: live preferences and live reservation state
 * Why: Preferences and reservations change between creation and dispatch; a moot job is skipped
 *      instead of sent
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.SkipReason;
import com.monsoonfire.notification.model.StorageStatus;
import com.monsoonfire.notification.repository.ReservationRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobEligibilityService {

  private final ReservationRoutingService routingService;
  private final ReservationRepository reservationRepository;

  public Eligibility evaluate(NotificationJob job) {
    if (!job.type().isReservationType()) {
      return Eligibility.send(job.channels(), null);
    }
    final ReservationRouting routing = routingService.resolve(job.uid());
    final Optional<SkipReason> routingSkip = routing.skipReason();
    if (routingSkip.isPresent()) {
      return Eligibility.skip(routingSkip.get());
    }
    if (job.type().requiresLiveReservation()) {
      final Optional<SkipReason> liveSkip = checkLiveReservation(job);
      if (liveSkip.isPresent()) {
        return Eligibility.skip(liveSkip.get());
      }
    }
    return Eligibility.send(routing.channels(), routing);
  }

  private Optional<SkipReason> checkLiveReservation(NotificationJob job) {
    final String reservationId = job.reservationId();
    if (reservationId == null || reservationId.isBlank()) {
      return Optional.of(SkipReason.RESERVATION_ID_MISSING);
    }
    final Optional<ReservationSnapshot> found =
        reservationRepository.findById(reservationId.trim());
    if (found.isEmpty()) {
      return Optional.of(SkipReason.RESERVATION_NOT_FOUND);
    }
    final ReservationSnapshot reservation = found.get();
    if (job.type() == NotificationJobType.RESERVATION_DELAY_FOLLOW_UP) {
      return isStillDelayed(reservation)
          ? Optional.empty()
          : Optional.of(SkipReason.RESERVATION_NO_LONGER_DELAYED);
    }
    if (!reservation.isLoaded() || reservation.isCancelled()) {
      return Optional.of(SkipReason.RESERVATION_NOT_READY_FOR_PICKUP);
    }
    // a reminder that itself carries the stored status announces that transition and still goes out
    if (reservation.currentStorageStatus() == StorageStatus.STORED_BY_POLICY
        && job.payload().storageStatus() != StorageStatus.STORED_BY_POLICY) {
      return Optional.of(SkipReason.RESERVATION_STORAGE_FINALIZED);
    }
    final Integer ordinal = job.payload().reminderOrdinal();
    // the sweep records ordinal n before its job runs; a higher count means a later reminder
    // superseded this one
    if (ordinal != null && reservation.pickupReminderCount() > Math.max(1, ordinal)) {
      return Optional.of(SkipReason.REMINDER_ALREADY_RECORDED);
    }
    return Optional.empty();
  }

  static boolean isStillDelayed(ReservationSnapshot reservation) {
    return reservation.estimatedWindow().isDelayed()
        && !reservation.isCancelled()
        && !reservation.isLoaded();
  }

  /** Either channels to send on, or the reason the job is skipped. */
  public record Eligibility(
      DeliveryChannels channels, ReservationRouting routing, SkipReason skipReason) {

    static Eligibility send(DeliveryChannels channels, ReservationRouting routing) {
      return new Eligibility(channels, routing, null);
    }

    static Eligibility skip(SkipReason reason) {
      return new Eligibility(DeliveryChannels.none(), null, reason);
    }

    public boolean skipped() {
      return skipReason != null;
    }
  }
}
