/*
 * Where: Notification storage-policy engine
 * What: Sweeps pickup-ready reservations, persists policy decisions and enqueues reminder jobs
 * Why: Each reservation is evaluated under its own row lock and transaction so one bad row does
 *      not stop the sweep
 */
package com.monsoonfire.notification.service.storage;

import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.PickupWindowStatus;
import com.monsoonfire.notification.model.ReservationEventKind;
import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.repository.ReservationRepository;
import com.monsoonfire.notification.repository.ReservationStorageAuditRepository;
import com.monsoonfire.notification.service.NotificationJobEnqueuer;
import com.monsoonfire.notification.service.NotificationMetrics;
import com.monsoonfire.notification.service.ReservationPayloads;
import com.monsoonfire.notification.service.ReservationRoutingService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ReservationStoragePolicyService {

  private static final Logger logger =
      LoggerFactory.getLogger(ReservationStoragePolicyService.class);

  private final ReservationRepository reservationRepository;
  private final ReservationStorageAuditRepository auditRepository;
  private final ReservationStoragePolicy policy;
  private final ReservationRoutingService routingService;
  private final NotificationJobEnqueuer enqueuer;
  private final NotificationMetrics metrics;
  private final StoragePolicyProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;
  private final ReentrantLock sweepLock = new ReentrantLock();

  /** Runs one sweep; a sweep already in progress in this instance makes this call a no-op. */
  public SweepSummary runSweep() {
    if (!sweepLock.tryLock()) {
      logger.info("storage policy sweep already running; skipped");
      return SweepSummary.busy();
    }
    try {
      return sweep(Instant.now(clock));
    } finally {
      sweepLock.unlock();
    }
  }

  private SweepSummary sweep(Instant now) {
    final List<String> candidates =
        reservationRepository.findStorageSweepCandidates(properties.batchLimit());
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    int updated = 0;
    int reminders = 0;
    int transitions = 0;
    int errors = 0;
    for (String reservationId : candidates) {
      try {
        final StorageDecision decision =
            transactionTemplate.execute(status -> evaluateLocked(reservationId, now));
        if (decision == null || !decision.changed()) {
          continue;
        }
        updated++;
        reminders += decision.reminders().size();
        transitions += decision.transitions().size();
        decision.transitions().forEach(metrics::recordStorageTransition);
      } catch (RuntimeException ex) {
        errors++;
        logger.error("storage policy evaluation failed reservationId={}", reservationId, ex);
      }
    }
    final SweepSummary summary =
        new SweepSummary(candidates.size(), updated, reminders, transitions, errors, false);
    logger.info(
        "storage policy sweep done candidates={} updated={} reminders={} transitions={} errors={}",
        summary.candidates(),
        summary.updated(),
        summary.remindersEnqueued(),
        summary.transitions(),
        summary.errors());
    return summary;
  }

  private StorageDecision evaluateLocked(String reservationId, Instant now) {
    final Optional<ReservationSnapshot> found =
        reservationRepository.findByIdForUpdate(reservationId);
    if (found.isEmpty() || !isSweepEligible(found.get())) {
      return null;
    }
    final StorageDecision decision = policy.evaluate(found.get(), now);
    if (!decision.changed()) {
      return decision;
    }
    final ReservationSnapshot reservation = decision.reservation();
    reservationRepository.updateStorageState(reservation, now);
    for (StorageAuditRecord audit : decision.audits()) {
      auditRepository.append(audit, properties.historyMax());
    }
    if (!decision.reminders().isEmpty()) {
      enqueueReminders(reservation, decision.reminders());
    }
    return decision;
  }

  private void enqueueReminders(ReservationSnapshot reservation, List<PendingReminder> reminders) {
    final String uid = reservation.ownerUid();
    if (uid == null || uid.isBlank()) {
      logger.warn(
          "pickup reminder not enqueued without owner reservationId={}",
          reservation.reservationId());
      return;
    }
    final ReservationRouting routing = routingService.resolve(uid);
    for (PendingReminder reminder : reminders) {
      final NotificationPayload payload =
          ReservationPayloads.base(null, reservation)
              .dedupeKey(reminder.dedupeKey())
              .eventKind(ReservationEventKind.PICKUP_REMINDER)
              .reason(reminder.reason())
              .storageStatus(reservation.currentStorageStatus())
              .previousStorageStatus(reminder.previousStatus())
              .reminderOrdinal(reminder.reminderOrdinal())
              .reminderCount(reservation.pickupReminderCount())
              .readyForPickupAtIso(ReservationPayloads.iso(reservation.readyForPickupAt()))
              .policyWindowLabel(reminder.policyWindowLabel())
              .build();
      enqueuer.enqueueReservationJob(
          NotificationJobType.RESERVATION_PICKUP_REMINDER, uid, routing, payload, null);
    }
  }

  static boolean isSweepEligible(ReservationSnapshot reservation) {
    return reservation.isLoaded()
        && !reservation.isCancelled()
        && reservation.pickupWindow().status() != PickupWindowStatus.COMPLETED;
  }

  /** Counters of one sweep; {@code skipped} is true when another sweep held the lock. */
  public record SweepSummary(
      int candidates,
      int updated,
      int remindersEnqueued,
      int transitions,
      int errors,
      boolean skipped) {

    static SweepSummary busy() {
      return new SweepSummary(0, 0, 0, 0, 0, true);
    }
  }
}
