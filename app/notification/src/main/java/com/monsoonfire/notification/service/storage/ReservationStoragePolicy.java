/*
 * Where: Notification storage-policy engine
 * What: Pure evaluation of one reservation against the pickup schedule at a given instant
 * Why: Keeping the state machine free of IO lets the sweep, the pickup-ready reset and the
 *      reminder-failure path share it and lets tests drive it with any clock
 */
package com.monsoonfire.notification.service.storage;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.PickupWindow;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.model.StorageNoticeEntry;
import com.monsoonfire.notification.model.StorageStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReservationStoragePolicy {

  static final String ACTION_WINDOW_MISSED = "pickup_window_missed";
  static final String ACTION_REMINDER_ENQUEUED = "pickup_reminder_enqueued";
  static final String ACTION_STATUS_TRANSITION = "storage_status_transition";
  static final String ACTION_PICKUP_READY = "pickup_ready";
  static final String ACTION_REMINDER_FAILED = "pickup_reminder_failed";
  static final String KIND_REMINDER_FAILED = "reminder_failed";
  private static final int FAILURE_DETAIL_MAX = 280;

  private final StoragePolicyProperties properties;

  /**
   * One sweep pass. Missing the confirmed pickup window pre-empts the ordinal reminder; the
   * elapsed-time ceiling is applied last and never lowers the status.
   */
  public StorageDecision evaluate(ReservationSnapshot reservation, Instant now) {
    final Instant anchor = reservation.pickupAnchor();
    if (anchor == null) {
      return StorageDecision.unchanged(reservation);
    }
    final Draft draft = new Draft(reservation, now);
    if (reservation.readyForPickupAt() == null) {
      draft.readyForPickupAt = anchor;
      draft.changed = true;
    }
    final Duration elapsed =
        now.isBefore(anchor) ? Duration.ZERO : Duration.between(anchor, now);

    if (draft.status != StorageStatus.STORED_BY_POLICY) {
      if (!applyMissedWindow(draft)) {
        applyDueReminder(draft, elapsed);
      }
    }

    final StorageStatus mandated = policyStatus(elapsed, draft.reminderCount);
    final StorageStatus target = StorageStatus.max(draft.status, mandated);
    if (target != draft.status) {
      final String detail = transitionDetail(target);
      draft.appendHistory(target.wireName(), detail, target, null, null);
      draft.audit(ACTION_STATUS_TRANSITION, detail, draft.status, target, null, null);
      draft.transitions.add(target);
      draft.status = target;
      draft.changed = true;
    }
    return draft.toDecision();
  }

  /**
   * Pickup-ready reset: status back to active, counters zeroed, history replaced by a single
   * pickup_ready notice. The only transition allowed to lower the status.
   *
   * <p>{@code readyAt} comes from the event that made the reservation loaded, so a reservation
   * loaded a second time is measured from the new load and not from the anchor it kept.
   */
  public StorageDecision pickupReady(
      ReservationSnapshot reservation, Instant readyAt, String detail, Instant now) {
    final Draft draft = new Draft(reservation, now);
    draft.history.clear();
    draft.readyForPickupAt = readyAt != null ? readyAt : now;
    draft.reminderCount = 0;
    draft.lastReminderAt = null;
    draft.failureCount = 0;
    draft.lastFailureAt = null;
    draft.appendHistory(ACTION_PICKUP_READY, detail, StorageStatus.ACTIVE, null, 0);
    draft.audit(ACTION_PICKUP_READY, detail, draft.status, StorageStatus.ACTIVE, null, 0);
    draft.status = StorageStatus.ACTIVE;
    draft.changed = true;
    return draft.toDecision();
  }

  /** Records a pickup reminder that ended in the dead letter. */
  public StorageDecision reminderFailed(
      ReservationSnapshot reservation,
      Integer reminderOrdinal,
      String failureCode,
      String message,
      String requestId,
      Instant now) {
    final Draft draft = new Draft(reservation, now);
    draft.requestId = requestId;
    draft.failureCount += 1;
    draft.lastFailureAt = now;
    final String detail = truncate(message == null ? "unknown error" : message, FAILURE_DETAIL_MAX);
    draft.history.add(
        new StorageNoticeEntry(
            now,
            KIND_REMINDER_FAILED,
            detail,
            draft.status,
            reminderOrdinal,
            draft.reminderCount,
            failureCode));
    draft.audits.add(
        draft.auditRecord(
            ACTION_REMINDER_FAILED,
            detail,
            draft.status,
            draft.status,
            reminderOrdinal,
            draft.reminderCount,
            failureCode));
    draft.changed = true;
    return draft.toDecision();
  }

  /** Status mandated by elapsed time alone. */
  StorageStatus policyStatus(Duration elapsed, int reminderCount) {
    if (elapsed.compareTo(properties.storedByPolicyAfter()) >= 0) {
      return StorageStatus.STORED_BY_POLICY;
    }
    if (elapsed.compareTo(properties.holdPendingAfter()) >= 0) {
      return StorageStatus.HOLD_PENDING;
    }
    return reminderCount > 0 ? StorageStatus.REMINDER_PENDING : StorageStatus.ACTIVE;
  }

  private boolean applyMissedWindow(Draft draft) {
    final PickupWindow window = draft.pickupWindow;
    if (window.status() == null
        || !window.status().isAwaitingPickup()
        || window.confirmedEnd() == null
        || window.confirmedEnd().isAfter(draft.now)) {
      return false;
    }
    final PickupWindow missed = window.markMissed(draft.now);
    final boolean repeated = missed.missedCount() >= 2;
    final StorageStatus target =
        StorageStatus.max(
            draft.status,
            repeated ? StorageStatus.STORED_BY_POLICY : StorageStatus.HOLD_PENDING);
    final String reason =
        repeated
            ? "Pickup window was missed again and reservation moved to stored-by-policy."
            : "Pickup window elapsed and reservation moved to hold-pending.";
    draft.appendHistory(ACTION_WINDOW_MISSED, reason, target, null, draft.reminderCount);
    draft.audit(ACTION_WINDOW_MISSED, reason, draft.status, target, null, draft.reminderCount);
    if (target != draft.status) {
      draft.transitions.add(target);
    }
    draft.reminders.add(
        new PendingReminder(
            "RESERVATION_PICKUP_WINDOW_MISSED:"
                + draft.reservationId
                + ":"
                + window.confirmedEnd().toEpochMilli()
                + ":"
                + missed.missedCount(),
            null,
            reason,
            "Pickup window missed. Staff follow-up is now required.",
            draft.status));
    draft.pickupWindow = missed;
    draft.status = target;
    draft.changed = true;
    return true;
  }

  private void applyDueReminder(Draft draft, Duration elapsed) {
    final Optional<Integer> due = nextDueOrdinal(elapsed, draft.reminderCount);
    if (due.isEmpty()) {
      return;
    }
    final int ordinal = due.get();
    final StorageStatus target =
        StorageStatus.max(
            draft.status,
            ordinal >= 3 ? StorageStatus.HOLD_PENDING : StorageStatus.REMINDER_PENDING);
    final String reason = reminderReason(ordinal);
    final StorageStatus from = draft.status;
    draft.reminderCount = ordinal;
    draft.lastReminderAt = draft.now;
    draft.appendHistory("pickup_reminder_" + ordinal, reason, target, ordinal, ordinal);
    draft.audit(ACTION_REMINDER_ENQUEUED, reason, from, target, ordinal, ordinal);
    if (target != from) {
      draft.transitions.add(target);
    }
    draft.reminders.add(
        new PendingReminder(
            "RESERVATION_PICKUP_REMINDER:"
                + draft.reservationId
                + ":"
                + draft.anchor()
                + ":"
                + ordinal,
            ordinal,
            reason,
            windowLabel(ordinal),
            from));
    draft.status = target;
    draft.changed = true;
  }

  /** The ordinal after the recorded count, when its threshold has elapsed. */
  Optional<Integer> nextDueOrdinal(Duration elapsed, int reminderCount) {
    final int next = reminderCount + 1;
    if (next < 1 || next > properties.reminderThresholds().size()) {
      return Optional.empty();
    }
    return elapsed.compareTo(properties.thresholdFor(next)) >= 0
        ? Optional.of(next)
        : Optional.empty();
  }

  static String reminderReason(int ordinal) {
    if (ordinal >= 3) {
      return "Final pickup reminder: reservation is nearing storage-hold policy thresholds.";
    }
    if (ordinal == 2) {
      return "Second pickup reminder: reservation is still awaiting pickup scheduling.";
    }
    return "Pickup reminder: reservation has been ready for collection for several days.";
  }

  String windowLabel(int ordinal) {
    if (ordinal >= 3) {
      return "Final reminder window. "
          + "Reservation moves to storage hold soon if pickup is still pending.";
    }
    final Duration checkpoint =
        ordinal < properties.reminderThresholds().size()
            ? properties.thresholdFor(ordinal + 1)
            : properties.holdPendingAfter();
    return "Next storage policy checkpoint is around "
        + checkpoint.toHours()
        + " hours after pickup-ready status.";
  }

  private static String transitionDetail(StorageStatus status) {
    return switch (status) {
      case STORED_BY_POLICY ->
          "Reservation reached storage policy threshold and is marked stored by policy.";
      case HOLD_PENDING -> "Reservation entered storage hold pending status.";
      case REMINDER_PENDING -> "Reservation storage status moved to reminder pending.";
      case ACTIVE -> "Reservation storage status returned to active.";
    };
  }

  static String auditId(
      String reservationId,
      String action,
      String requestId,
      Instant at,
      String reason,
      Integer reminderOrdinal,
      Integer reminderCount) {
    return DedupeHashes.sha256Hex(
        String.join(
            ":",
            reservationId,
            action,
            requestId == null ? "none" : requestId,
            at.toString(),
            reason == null ? "" : reason,
            reminderOrdinal == null ? "none" : reminderOrdinal.toString(),
            reminderCount == null ? "none" : reminderCount.toString()));
  }

  private static String truncate(String value, int maxLength) {
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }

  /** Mutable working copy of the policy-owned fields during one evaluation. */
  private final class Draft {
    private final ReservationSnapshot source;
    private final Instant now;
    private final String reservationId;
    private final List<StorageNoticeEntry> history;
    private final List<StorageAuditRecord> audits = new ArrayList<>();
    private final List<PendingReminder> reminders = new ArrayList<>();
    private final List<StorageStatus> transitions = new ArrayList<>();
    private StorageStatus status;
    private Instant readyForPickupAt;
    private int reminderCount;
    private Instant lastReminderAt;
    private int failureCount;
    private Instant lastFailureAt;
    private PickupWindow pickupWindow;
    private String requestId;
    private boolean changed;

    private Draft(ReservationSnapshot source, Instant now) {
      this.source = source;
      this.now = now;
      this.reservationId = source.reservationId();
      this.history = new ArrayList<>(source.storageNoticeHistory());
      this.status = source.currentStorageStatus();
      this.readyForPickupAt = source.readyForPickupAt();
      this.reminderCount = source.pickupReminderCount();
      this.lastReminderAt = source.lastReminderAt();
      this.failureCount = source.pickupReminderFailureCount();
      this.lastFailureAt = source.lastReminderFailureAt();
      this.pickupWindow = source.pickupWindow();
    }

    private String anchor() {
      return readyForPickupAt == null ? "unknown" : readyForPickupAt.toString();
    }

    private void appendHistory(
        String kind,
        String detail,
        StorageStatus entryStatus,
        Integer reminderOrdinal,
        Integer count) {
      history.add(
          new StorageNoticeEntry(now, kind, detail, entryStatus, reminderOrdinal, count, null));
    }

    private void audit(
        String action,
        String reason,
        StorageStatus from,
        StorageStatus to,
        Integer reminderOrdinal,
        Integer count) {
      audits.add(auditRecord(action, reason, from, to, reminderOrdinal, count, null));
    }

    private StorageAuditRecord auditRecord(
        String action,
        String reason,
        StorageStatus from,
        StorageStatus to,
        Integer reminderOrdinal,
        Integer count,
        String failureCode) {
      return new StorageAuditRecord(
          auditId(reservationId, action, requestId, now, reason, reminderOrdinal, count),
          reservationId,
          source.ownerUid(),
          action,
          reason,
          from,
          to,
          reminderOrdinal,
          count,
          failureCode,
          now);
    }

    private StorageDecision toDecision() {
      if (!changed) {
        return StorageDecision.unchanged(source);
      }
      final int historyMax = properties.historyMax();
      final List<StorageNoticeEntry> capped =
          history.size() <= historyMax
              ? history
              : history.subList(history.size() - historyMax, history.size());
      final ReservationSnapshot updated =
          source.toBuilder()
              .storageStatus(status)
              .readyForPickupAt(readyForPickupAt)
              .pickupReminderCount(reminderCount)
              .lastReminderAt(lastReminderAt)
              .pickupReminderFailureCount(failureCount)
              .lastReminderFailureAt(lastFailureAt)
              .storageNoticeHistory(capped)
              .pickupWindow(pickupWindow)
              .build();
      return new StorageDecision(
          updated,
          source.currentStorageStatus(),
          List.copyOf(reminders),
          List.copyOf(audits),
          List.copyOf(transitions),
          true);
    }
  }
}
