package com.monsoonfire.notification.service.storage;

import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.model.StorageStatus;
import java.util.List;

/** Outcome of evaluating one reservation; nothing is persisted when {@code changed} is false. */
public record StorageDecision(
    ReservationSnapshot reservation,
    StorageStatus previousStatus,
    List<PendingReminder> reminders,
    List<StorageAuditRecord> audits,
    List<StorageStatus> transitions,
    boolean changed) {

  static StorageDecision unchanged(ReservationSnapshot reservation) {
    return new StorageDecision(
        reservation, reservation.currentStorageStatus(), List.of(), List.of(), List.of(), false);
  }
}
