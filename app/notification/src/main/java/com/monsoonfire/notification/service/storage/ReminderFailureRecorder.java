package com.monsoonfire.notification.service.storage;

import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.repository.ReservationRepository;
import com.monsoonfire.notification.repository.ReservationStorageAuditRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Writes the reminder-failure history and audit entry for a dead-lettered pickup reminder. */
@Service
@RequiredArgsConstructor
public class ReminderFailureRecorder {

  private static final Logger logger = LoggerFactory.getLogger(ReminderFailureRecorder.class);

  private final ReservationRepository reservationRepository;
  private final ReservationStorageAuditRepository auditRepository;
  private final ReservationStoragePolicy policy;
  private final StoragePolicyProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /** Returns true when a failure was recorded; other job types are ignored. */
  public boolean record(NotificationJob job, NotificationErrorClass errorClass, String message) {
    if (job.type() != NotificationJobType.RESERVATION_PICKUP_REMINDER) {
      return false;
    }
    final String reservationId = job.reservationId();
    if (reservationId == null || reservationId.isBlank()) {
      return false;
    }
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean recorded =
        transactionTemplate.execute(
            status -> {
              final Optional<ReservationSnapshot> found =
                  reservationRepository.findByIdForUpdate(reservationId.trim());
              if (found.isEmpty()) {
                return false;
              }
              final Instant now = Instant.now(clock);
              final StorageDecision decision =
                  policy.reminderFailed(
                      found.get(),
                      job.payload().reminderOrdinal(),
                      errorClass.wireName(),
                      message,
                      job.jobId(),
                      now);
              reservationRepository.updateStorageState(decision.reservation(), now);
              for (StorageAuditRecord audit : decision.audits()) {
                auditRepository.append(audit, properties.historyMax());
              }
              return true;
            });
    if (Boolean.TRUE.equals(recorded)) {
      logger.warn(
          "pickup reminder failure recorded reservationId={} jobId={} errorClass={}",
          reservationId,
          job.jobId(),
          errorClass.wireName());
      return true;
    }
    return false;
  }
}
