/*
 * Where: Notification storage-policy engine tests
 * What: Drives the pickup state machine at fixed elapsed times from the pickup anchor
 * Why: Reminder ordinals, window misses and the hold/stored ceilings must compose without ever
 *      lowering the status outside the pickup-ready reset
 */
package com.monsoonfire.notification.service.storage;

import static org.assertj.core.api.Assertions.assertThat;

import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.PickupWindow;
import com.monsoonfire.notification.model.PickupWindowStatus;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageNoticeEntry;
import com.monsoonfire.notification.model.StorageStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReservationStoragePolicyTest {

  private static final Instant READY_AT = Instant.parse("2026-01-10T00:00:00Z");
  private static final StoragePolicyProperties PROPERTIES =
      new StoragePolicyProperties(null, null, null, null, null, null, null);

  private final ReservationStoragePolicy policy = new ReservationStoragePolicy(PROPERTIES);

  @Test
  void nothingHappensBeforeTheFirstThreshold() {
    final StorageDecision decision = policy.evaluate(reservation().build(), at(10));

    assertThat(decision.changed()).isFalse();
    assertThat(decision.reminders()).isEmpty();
    assertThat(decision.reservation().currentStorageStatus()).isEqualTo(StorageStatus.ACTIVE);
  }

  @Test
  void firstReminderAfterSeventyTwoHours() {
    final StorageDecision decision = policy.evaluate(reservation().build(), at(80));

    assertThat(decision.changed()).isTrue();
    assertThat(decision.reservation().storageStatus()).isEqualTo(StorageStatus.REMINDER_PENDING);
    assertThat(decision.reservation().pickupReminderCount()).isEqualTo(1);
    assertThat(decision.reservation().lastReminderAt()).isEqualTo(at(80));
    assertThat(decision.transitions()).containsExactly(StorageStatus.REMINDER_PENDING);
    assertThat(decision.reminders())
        .singleElement()
        .satisfies(
            reminder -> {
              assertThat(reminder.reminderOrdinal()).isEqualTo(1);
              assertThat(reminder.previousStatus()).isEqualTo(StorageStatus.ACTIVE);
              assertThat(reminder.dedupeKey())
                  .isEqualTo("RESERVATION_PICKUP_REMINDER:res-1:" + READY_AT + ":1");
              assertThat(reminder.policyWindowLabel()).contains("120 hours");
            });
    assertThat(decision.audits())
        .extracting(audit -> audit.action())
        .containsExactly(ReservationStoragePolicy.ACTION_REMINDER_ENQUEUED);
  }

  @Test
  void holdCeilingAppliesAfterTheReminderAtOneHundredThirtyHours() {
    final StorageDecision decision = policy.evaluate(reservation().build(), at(130));

    // only the next ordinal is issued per pass
    assertThat(decision.reminders())
        .extracting(PendingReminder::reminderOrdinal)
        .containsExactly(1);
    assertThat(decision.transitions())
        .containsExactly(StorageStatus.REMINDER_PENDING, StorageStatus.HOLD_PENDING);
    assertThat(decision.reservation().storageStatus()).isEqualTo(StorageStatus.HOLD_PENDING);
  }

  @Test
  void storedCeilingAppliesAtTwoHundredHours() {
    final StorageDecision decision =
        policy.evaluate(
            reservation()
                .storageStatus(StorageStatus.HOLD_PENDING)
                .pickupReminderCount(3)
                .build(),
            at(200));

    assertThat(decision.reminders()).isEmpty();
    assertThat(decision.transitions()).containsExactly(StorageStatus.STORED_BY_POLICY);
    assertThat(decision.reservation().storageStatus()).isEqualTo(StorageStatus.STORED_BY_POLICY);
    assertThat(decision.reservation().storageNoticeHistory())
        .extracting(StorageNoticeEntry::kind)
        .containsExactly("stored_by_policy");
  }

  @Test
  void statusNeverMovesBackwards() {
    final ReservationSnapshot held =
        reservation().storageStatus(StorageStatus.HOLD_PENDING).pickupReminderCount(2).build();

    final StorageDecision decision = policy.evaluate(held, at(80));

    assertThat(decision.changed()).isFalse();
    assertThat(decision.reservation().storageStatus()).isEqualTo(StorageStatus.HOLD_PENDING);
  }

  @Test
  void storedReservationsReceiveNoFurtherReminders() {
    final ReservationSnapshot stored =
        reservation().storageStatus(StorageStatus.STORED_BY_POLICY).pickupReminderCount(1).build();

    final StorageDecision decision = policy.evaluate(stored, at(300));

    assertThat(decision.changed()).isFalse();
    assertThat(decision.reminders()).isEmpty();
  }

  @Test
  void missingTheConfirmedWindowMovesToHoldAndPreemptsTheOrdinalReminder() {
    final Instant windowEnd = at(78);
    final ReservationSnapshot reservation =
        reservation().pickupWindow(window(PickupWindowStatus.CONFIRMED, windowEnd, 0)).build();

    final StorageDecision decision = policy.evaluate(reservation, at(80));

    assertThat(decision.reservation().storageStatus()).isEqualTo(StorageStatus.HOLD_PENDING);
    assertThat(decision.reservation().pickupReminderCount()).isZero();
    assertThat(decision.reservation().pickupWindow().status()).isEqualTo(PickupWindowStatus.MISSED);
    assertThat(decision.reservation().pickupWindow().missedCount()).isEqualTo(1);
    assertThat(decision.reservation().pickupWindow().lastMissedAt()).isEqualTo(at(80));
    assertThat(decision.reminders())
        .singleElement()
        .satisfies(
            reminder -> {
              assertThat(reminder.reminderOrdinal()).isNull();
              assertThat(reminder.dedupeKey())
                  .isEqualTo(
                      "RESERVATION_PICKUP_WINDOW_MISSED:res-1:" + windowEnd.toEpochMilli() + ":1");
            });
  }

  @Test
  void secondMissMovesToStoredByPolicy() {
    final ReservationSnapshot reservation =
        reservation()
            .storageStatus(StorageStatus.HOLD_PENDING)
            .pickupWindow(window(PickupWindowStatus.OPEN, at(20), 1))
            .build();

    final StorageDecision decision = policy.evaluate(reservation, at(30));

    assertThat(decision.reservation().storageStatus()).isEqualTo(StorageStatus.STORED_BY_POLICY);
    assertThat(decision.transitions()).containsExactly(StorageStatus.STORED_BY_POLICY);
    assertThat(decision.reservation().pickupWindow().missedCount()).isEqualTo(2);
    assertThat(decision.reminders()).hasSize(1);
  }

  @Test
  void windowStillOpenIsNotMissed() {
    final ReservationSnapshot reservation =
        reservation().pickupWindow(window(PickupWindowStatus.CONFIRMED, at(40), 0)).build();

    final StorageDecision decision = policy.evaluate(reservation, at(30));

    assertThat(decision.changed()).isFalse();
  }

  @Test
  void missingReadyTimestampIsBackfilledFromTheAnchor() {
    final Instant updatedAt = Instant.parse("2026-01-11T00:00:00Z");
    final ReservationSnapshot reservation =
        reservation().readyForPickupAt(null).updatedAt(updatedAt).build();

    final StorageDecision decision = policy.evaluate(reservation, updatedAt.plusSeconds(60));

    assertThat(decision.changed()).isTrue();
    assertThat(decision.reservation().readyForPickupAt()).isEqualTo(updatedAt);
    assertThat(decision.reminders()).isEmpty();
  }

  @Test
  void pickupReadyResetsEverything() {
    final ReservationSnapshot stored =
        reservation()
            .storageStatus(StorageStatus.STORED_BY_POLICY)
            .pickupReminderCount(3)
            .pickupReminderFailureCount(2)
            .lastReminderAt(at(170))
            .storageNoticeHistory(List.of(entry("pickup_reminder_1"), entry("stored_by_policy")))
            .build();

    final StorageDecision decision =
        policy.pickupReady(stored, READY_AT, "Loaded for pickup", at(210));

    final ReservationSnapshot reset = decision.reservation();
    assertThat(reset.storageStatus()).isEqualTo(StorageStatus.ACTIVE);
    assertThat(reset.pickupReminderCount()).isZero();
    assertThat(reset.pickupReminderFailureCount()).isZero();
    assertThat(reset.lastReminderAt()).isNull();
    assertThat(reset.readyForPickupAt()).isEqualTo(READY_AT);
    assertThat(reset.storageNoticeHistory())
        .singleElement()
        .satisfies(notice -> assertThat(notice.kind()).isEqualTo("pickup_ready"));
    assertThat(decision.previousStatus()).isEqualTo(StorageStatus.STORED_BY_POLICY);
  }

  @Test
  void reloadedReservationIsMeasuredFromTheNewLoad() {
    final ReservationSnapshot stored =
        reservation()
            .storageStatus(StorageStatus.HOLD_PENDING)
            .pickupReminderCount(2)
            .lastReminderAt(at(120))
            .build();
    final Instant reloadedAt = at(200);

    final ReservationSnapshot reset =
        policy.pickupReady(stored, reloadedAt, "Loaded again", reloadedAt).reservation();
    final StorageDecision nextSweep = policy.evaluate(reset, reloadedAt.plus(Duration.ofHours(1)));

    assertThat(reset.readyForPickupAt()).isEqualTo(reloadedAt);
    assertThat(nextSweep.reservation().storageStatus()).isEqualTo(StorageStatus.ACTIVE);
    assertThat(nextSweep.reminders()).isEmpty();
  }

  @Test
  void reminderFailureIsCountedAndTruncated() {
    final String longMessage = "x".repeat(400);

    final StorageDecision decision =
        policy.reminderFailed(
            reservation().pickupReminderCount(1).build(),
            1,
            "provider_5xx",
            longMessage,
            "job-1",
            at(90));

    final ReservationSnapshot updated = decision.reservation();
    assertThat(updated.pickupReminderFailureCount()).isEqualTo(1);
    assertThat(updated.lastReminderFailureAt()).isEqualTo(at(90));
    assertThat(updated.storageNoticeHistory())
        .singleElement()
        .satisfies(
            notice -> {
              assertThat(notice.kind()).isEqualTo(ReservationStoragePolicy.KIND_REMINDER_FAILED);
              assertThat(notice.detail()).hasSize(280);
              assertThat(notice.failureCode()).isEqualTo("provider_5xx");
            });
    assertThat(decision.audits())
        .singleElement()
        .satisfies(
            audit ->
                assertThat(audit.action())
                    .isEqualTo(ReservationStoragePolicy.ACTION_REMINDER_FAILED));
  }

  @Test
  void historyKeepsOnlyTheMostRecentEntries() {
    final List<StorageNoticeEntry> history = new ArrayList<>();
    for (int i = 0; i < PROPERTIES.historyMax(); i++) {
      history.add(entry("old_" + i));
    }

    final StorageDecision decision =
        policy.evaluate(reservation().storageNoticeHistory(history).build(), at(80));

    final List<StorageNoticeEntry> kept = decision.reservation().storageNoticeHistory();
    assertThat(kept).hasSize(PROPERTIES.historyMax());
    assertThat(kept.get(0).kind()).isEqualTo("old_1");
    assertThat(kept.get(kept.size() - 1).kind()).isEqualTo("pickup_reminder_1");
  }

  @Test
  void policyStatusThresholds() {
    assertThat(policy.policyStatus(Duration.ofHours(0), 0)).isEqualTo(StorageStatus.ACTIVE);
    assertThat(policy.policyStatus(Duration.ofHours(80), 1))
        .isEqualTo(StorageStatus.REMINDER_PENDING);
    assertThat(policy.policyStatus(Duration.ofHours(120), 0)).isEqualTo(StorageStatus.HOLD_PENDING);
    assertThat(policy.policyStatus(Duration.ofHours(192), 0))
        .isEqualTo(StorageStatus.STORED_BY_POLICY);
  }

  @Test
  void auditIdIsStableForTheSameInputs() {
    final String first =
        ReservationStoragePolicy.auditId("res-1", "pickup_ready", null, READY_AT, "r", null, 0);
    final String second =
        ReservationStoragePolicy.auditId("res-1", "pickup_ready", null, READY_AT, "r", null, 0);
    final String other =
        ReservationStoragePolicy.auditId("res-1", "pickup_ready", "req", READY_AT, "r", null, 0);

    assertThat(first).isEqualTo(second).hasSize(64);
    assertThat(other).isNotEqualTo(first);
  }

  private static Instant at(int hoursAfterReady) {
    return READY_AT.plus(Duration.ofHours(hoursAfterReady));
  }

  private static ReservationSnapshot.ReservationSnapshotBuilder reservation() {
    return ReservationSnapshot.builder()
        .reservationId("res-1")
        .ownerUid("user-1")
        .status("CONFIRMED")
        .loadStatus("loaded")
        .createdAt(READY_AT.minus(Duration.ofDays(5)))
        .updatedAt(READY_AT)
        .storageStatus(StorageStatus.ACTIVE)
        .readyForPickupAt(READY_AT);
  }

  private static PickupWindow window(PickupWindowStatus status, Instant confirmedEnd, int missed) {
    return new PickupWindow(
        null,
        null,
        confirmedEnd.minus(Duration.ofHours(2)),
        confirmedEnd,
        status,
        READY_AT,
        null,
        missed,
        0,
        null);
  }

  private static StorageNoticeEntry entry(String kind) {
    return new StorageNoticeEntry(READY_AT, kind, "detail", StorageStatus.ACTIVE, null, null, null);
  }
}
