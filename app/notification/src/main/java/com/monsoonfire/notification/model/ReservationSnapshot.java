/*
 * Where: Notification model
 * What: Read-mostly view of a reservation shared by the event handler and the storage sweep
 * Why: Both paths decide from the same fields, so the projection is kept in one shape
 */
package com.monsoonfire.notification.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import lombok.Builder;

@Builder(toBuilder = true)
public record ReservationSnapshot(
    String reservationId,
    String ownerUid,
    String status,
    String loadStatus,
    Instant createdAt,
    Instant updatedAt,
    EstimatedWindow estimatedWindow,
    String stageReason,
    String stageNotes,
    String staffNotes,
    StorageStatus storageStatus,
    Instant readyForPickupAt,
    int pickupReminderCount,
    Instant lastReminderAt,
    int pickupReminderFailureCount,
    Instant lastReminderFailureAt,
    List<StorageNoticeEntry> storageNoticeHistory,
    PickupWindow pickupWindow) {

  public ReservationSnapshot {
    estimatedWindow = estimatedWindow == null ? EstimatedWindow.empty() : estimatedWindow;
    pickupWindow = pickupWindow == null ? PickupWindow.empty() : pickupWindow;
    storageNoticeHistory =
        storageNoticeHistory == null ? List.of() : List.copyOf(storageNoticeHistory);
  }

  public StorageStatus currentStorageStatus() {
    return storageStatus == null ? StorageStatus.ACTIVE : storageStatus;
  }

  public boolean isLoaded() {
    return loadStatus != null && "loaded".equals(loadStatus.toLowerCase(Locale.ROOT));
  }

  public boolean isCancelled() {
    return "CANCELLED".equals(normalizedStatus());
  }

  public boolean isPickupCompleted() {
    return pickupWindow.status() == PickupWindowStatus.COMPLETED;
  }

  /** Status upper-cased with the US spelling of cancelled folded in. */
  public String normalizedStatus() {
    if (status == null || status.isBlank()) {
      return null;
    }
    final String upper = status.trim().toUpperCase(Locale.ROOT);
    return "CANCELED".equals(upper) ? "CANCELLED" : upper;
  }

  /** Pickup anchor: ready-for-pickup time, else the last update, else creation. */
  public Instant pickupAnchor() {
    if (readyForPickupAt != null) {
      return readyForPickupAt;
    }
    return updatedAt != null ? updatedAt : createdAt;
  }

  public String reasonOr(String fallback) {
    for (String candidate : new String[] {stageReason, stageNotes, staffNotes}) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return fallback;
  }
}
