package com.monsoonfire.notification.service.storage;

import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.model.StorageStatus;
import com.monsoonfire.notification.repository.ReservationRepository;
import com.monsoonfire.notification.repository.ReservationStorageAuditRepository;
import com.monsoonfire.notification.service.NotificationMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resets the storage-policy state when a reservation becomes ready for pickup. Callers run it
 * inside the transaction that upserted the reservation.
 */
@Service
@RequiredArgsConstructor
public class PickupReadyService {

  private static final Logger logger = LoggerFactory.getLogger(PickupReadyService.class);

  private final ReservationRepository reservationRepository;
  private final ReservationStorageAuditRepository auditRepository;
  private final ReservationStoragePolicy policy;
  private final NotificationMetrics metrics;
  private final StoragePolicyProperties properties;
  private final Clock clock;

  public Optional<ReservationSnapshot> markReady(
      String reservationId, Instant readyAt, String detail) {
    final Optional<ReservationSnapshot> found =
        reservationRepository.findByIdForUpdate(reservationId);
    if (found.isEmpty()) {
      logger.warn("pickup-ready reset skipped for unknown reservationId={}", reservationId);
      return Optional.empty();
    }
    final Instant now = Instant.now(clock);
    final StorageDecision decision = policy.pickupReady(found.get(), readyAt, detail, now);
    reservationRepository.updateStorageState(decision.reservation(), now);
    for (StorageAuditRecord audit : decision.audits()) {
      auditRepository.append(audit, properties.historyMax());
    }
    if (decision.previousStatus() != StorageStatus.ACTIVE) {
      metrics.recordStorageTransition(StorageStatus.ACTIVE);
    }
    logger.info(
        "reservation storage reset to active reservationId={} previousStatus={}",
        reservationId,
        decision.previousStatus().wireName());
    return Optional.of(decision.reservation());
  }
}
