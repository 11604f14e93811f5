package com.monsoonfire.notification.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.NotificationPreferences;
import com.monsoonfire.notification.model.PickupWindow;
import com.monsoonfire.notification.model.PickupWindowStatus;
import com.monsoonfire.notification.model.ReservationEventKind;
import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.model.StorageStatus;
import com.monsoonfire.notification.repository.ReservationRepository;
import com.monsoonfire.notification.repository.ReservationStorageAuditRepository;
import com.monsoonfire.notification.service.NotificationJobEnqueuer;
import com.monsoonfire.notification.service.NotificationMetrics;
import com.monsoonfire.notification.service.ReservationRoutingService;
import com.monsoonfire.notification.service.storage.ReservationStoragePolicyService.SweepSummary;
import com.monsoonfire.notification.support.NoOpTransactionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

@ExtendWith(MockitoExtension.class)
class ReservationStoragePolicyServiceTest {

  private static final Instant READY_AT = Instant.parse("2026-01-10T00:00:00Z");
  private static final Instant NOW = READY_AT.plus(Duration.ofHours(80));
  private static final StoragePolicyProperties PROPERTIES =
      new StoragePolicyProperties(null, null, 25, null, null, null, null);
  private static final ReservationRouting ROUTING =
      new ReservationRouting(NotificationPreferences.defaults(), true);

  @Mock private ReservationRepository reservationRepository;
  @Mock private ReservationStorageAuditRepository auditRepository;
  @Mock private ReservationRoutingService routingService;
  @Mock private NotificationJobEnqueuer enqueuer;
  @Captor private ArgumentCaptor<ReservationSnapshot> snapshotCaptor;
  @Captor private ArgumentCaptor<NotificationPayload> payloadCaptor;

  private SimpleMeterRegistry registry;
  private ReservationStoragePolicyService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new ReservationStoragePolicyService(
            reservationRepository,
            auditRepository,
            new ReservationStoragePolicy(PROPERTIES),
            routingService,
            enqueuer,
            new NotificationMetrics(registry),
            PROPERTIES,
            Clock.fixed(NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void sweepPersistsDecisionAndEnqueuesReminder() {
    when(reservationRepository.findStorageSweepCandidates(25)).thenReturn(List.of("res-1"));
    when(reservationRepository.findByIdForUpdate("res-1"))
        .thenReturn(Optional.of(loaded("res-1").build()));
    when(routingService.resolve("user-1")).thenReturn(ROUTING);

    final SweepSummary summary = service.runSweep();

    assertThat(summary).isEqualTo(new SweepSummary(1, 1, 1, 1, 0, false));
    verify(reservationRepository).updateStorageState(snapshotCaptor.capture(), eq(NOW));
    assertThat(snapshotCaptor.getValue().storageStatus())
        .isEqualTo(StorageStatus.REMINDER_PENDING);
    assertThat(snapshotCaptor.getValue().pickupReminderCount()).isEqualTo(1);
    verify(auditRepository).append(any(StorageAuditRecord.class), eq(60));
    verify(enqueuer)
        .enqueueReservationJob(
            eq(NotificationJobType.RESERVATION_PICKUP_REMINDER),
            eq("user-1"),
            eq(ROUTING),
            payloadCaptor.capture(),
            isNull());
    final NotificationPayload payload = payloadCaptor.getValue();
    assertThat(payload.eventKind()).isEqualTo(ReservationEventKind.PICKUP_REMINDER);
    assertThat(payload.reminderOrdinal()).isEqualTo(1);
    assertThat(payload.reminderCount()).isEqualTo(1);
    assertThat(payload.storageStatus()).isEqualTo(StorageStatus.REMINDER_PENDING);
    assertThat(payload.previousStorageStatus()).isEqualTo(StorageStatus.ACTIVE);
    assertThat(payload.dedupeKey())
        .isEqualTo("RESERVATION_PICKUP_REMINDER:res-1:" + READY_AT + ":1");
    assertThat(
            registry
                .get("notification.storage.transition")
                .tag("to", "reminder_pending")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void oneFailingReservationDoesNotStopTheSweep() {
    when(reservationRepository.findStorageSweepCandidates(25))
        .thenReturn(List.of("res-broken", "res-1"));
    when(reservationRepository.findByIdForUpdate("res-broken"))
        .thenThrow(new CannotAcquireLockException("lock timeout"));
    when(reservationRepository.findByIdForUpdate("res-1"))
        .thenReturn(Optional.of(loaded("res-1").build()));
    when(routingService.resolve("user-1")).thenReturn(ROUTING);

    final SweepSummary summary = service.runSweep();

    assertThat(summary.candidates()).isEqualTo(2);
    assertThat(summary.errors()).isEqualTo(1);
    assertThat(summary.updated()).isEqualTo(1);
  }

  @Test
  void ineligibleAndUnchangedReservationsAreNotWritten() {
    when(reservationRepository.findStorageSweepCandidates(25))
        .thenReturn(List.of("res-cancelled", "res-fresh", "res-gone"));
    when(reservationRepository.findByIdForUpdate("res-cancelled"))
        .thenReturn(Optional.of(loaded("res-cancelled").status("CANCELED").build()));
    when(reservationRepository.findByIdForUpdate("res-fresh"))
        .thenReturn(Optional.of(loaded("res-fresh").readyForPickupAt(NOW).build()));
    when(reservationRepository.findByIdForUpdate("res-gone")).thenReturn(Optional.empty());

    final SweepSummary summary = service.runSweep();

    assertThat(summary).isEqualTo(new SweepSummary(3, 0, 0, 0, 0, false));
    verify(reservationRepository, never()).updateStorageState(any(), any());
    verify(enqueuer, never()).enqueueReservationJob(any(), any(), any(), any(), any());
  }

  @Test
  void reminderWithoutOwnerIsPersistedButNotEnqueued() {
    when(reservationRepository.findStorageSweepCandidates(25)).thenReturn(List.of("res-1"));
    when(reservationRepository.findByIdForUpdate("res-1"))
        .thenReturn(Optional.of(loaded("res-1").ownerUid(null).build()));

    final SweepSummary summary = service.runSweep();

    assertThat(summary.updated()).isEqualTo(1);
    verify(reservationRepository).updateStorageState(any(), eq(NOW));
    verify(enqueuer, never()).enqueueReservationJob(any(), any(), any(), any(), any());
  }

  @Test
  void completedPickupIsNotSweepEligible() {
    final PickupWindow completed =
        new PickupWindow(
            null, null, null, null, PickupWindowStatus.COMPLETED, null, NOW, 0, 0, null);

    assertThat(ReservationStoragePolicyService.isSweepEligible(loaded("res-1").build())).isTrue();
    assertThat(
            ReservationStoragePolicyService.isSweepEligible(
                loaded("res-1").pickupWindow(completed).build()))
        .isFalse();
    assertThat(
            ReservationStoragePolicyService.isSweepEligible(
                loaded("res-1").loadStatus("queued").build()))
        .isFalse();
  }

  private static ReservationSnapshot.ReservationSnapshotBuilder loaded(String reservationId) {
    return ReservationSnapshot.builder()
        .reservationId(reservationId)
        .ownerUid("user-1")
        .status("CONFIRMED")
        .loadStatus("loaded")
        .updatedAt(READY_AT)
        .storageStatus(StorageStatus.ACTIVE)
        .readyForPickupAt(READY_AT);
  }
}
