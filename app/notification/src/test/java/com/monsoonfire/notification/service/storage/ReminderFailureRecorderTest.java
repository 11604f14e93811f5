package com.monsoonfire.notification.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.monsoonfire.notification.config.StoragePolicyProperties;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.JobStatus;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.model.StorageAuditRecord;
import com.monsoonfire.notification.model.StorageNoticeEntry;
import com.monsoonfire.notification.model.StorageStatus;
import com.monsoonfire.notification.repository.ReservationRepository;
import com.monsoonfire.notification.repository.ReservationStorageAuditRepository;
import com.monsoonfire.notification.support.NoOpTransactionManager;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReminderFailureRecorderTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final StoragePolicyProperties PROPERTIES =
      new StoragePolicyProperties(null, null, null, null, null, null, null);

  @Mock private ReservationRepository reservationRepository;
  @Mock private ReservationStorageAuditRepository auditRepository;
  @Captor private ArgumentCaptor<ReservationSnapshot> snapshotCaptor;
  @Captor private ArgumentCaptor<StorageAuditRecord> auditCaptor;

  private ReminderFailureRecorder recorder;

  @BeforeEach
  void setUp() {
    recorder =
        new ReminderFailureRecorder(
            reservationRepository,
            auditRepository,
            new ReservationStoragePolicy(PROPERTIES),
            PROPERTIES,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void deadLetteredReminderIsRecordedOnTheReservation() {
    when(reservationRepository.findByIdForUpdate("res-1"))
        .thenReturn(
            Optional.of(
                ReservationSnapshot.builder()
                    .reservationId("res-1")
                    .ownerUid("user-1")
                    .loadStatus("loaded")
                    .storageStatus(StorageStatus.REMINDER_PENDING)
                    .pickupReminderCount(2)
                    .build()));

    final boolean recorded =
        recorder.record(
            job(NotificationJobType.RESERVATION_PICKUP_REMINDER, " res-1 "),
            NotificationErrorClass.AUTH,
            "SMTP auth rejected");

    assertThat(recorded).isTrue();
    verify(reservationRepository).updateStorageState(snapshotCaptor.capture(), eq(FIXED_NOW));
    final ReservationSnapshot saved = snapshotCaptor.getValue();
    assertThat(saved.pickupReminderFailureCount()).isEqualTo(1);
    assertThat(saved.lastReminderFailureAt()).isEqualTo(FIXED_NOW);
    assertThat(saved.storageStatus()).isEqualTo(StorageStatus.REMINDER_PENDING);
    assertThat(saved.storageNoticeHistory())
        .singleElement()
        .satisfies(
            entry -> {
              assertThat(entry.kind()).isEqualTo("reminder_failed");
              assertThat(entry.reminderOrdinal()).isEqualTo(2);
              assertThat(entry.failureCode()).isEqualTo("auth");
              assertThat(entry.detail()).isEqualTo("SMTP auth rejected");
            });
    verify(auditRepository).append(auditCaptor.capture(), eq(60));
    assertThat(auditCaptor.getValue().failureCode()).isEqualTo("auth");
    assertThat(saved.storageNoticeHistory())
        .extracting(StorageNoticeEntry::at)
        .containsOnly(FIXED_NOW);
  }

  @Test
  void otherJobTypesAreIgnored() {
    assertThat(
            recorder.record(
                job(NotificationJobType.RESERVATION_STATUS, "res-1"),
                NotificationErrorClass.NETWORK,
                "timeout"))
        .isFalse();
    verifyNoInteractions(reservationRepository, auditRepository);
  }

  @Test
  void missingReservationRecordsNothing() {
    when(reservationRepository.findByIdForUpdate("res-1")).thenReturn(Optional.empty());

    assertThat(
            recorder.record(
                job(NotificationJobType.RESERVATION_PICKUP_REMINDER, "res-1"),
                NotificationErrorClass.PROVIDER_4XX,
                "bad address"))
        .isFalse();
    verify(reservationRepository, never()).updateStorageState(any(), any());
  }

  private static NotificationJob job(NotificationJobType type, String reservationId) {
    return new NotificationJob(
        "job-1",
        "RESERVATION_PICKUP_REMINDER:res-1:2026-01-10T00:00:00Z:2",
        type,
        "user-1",
        DeliveryChannels.inAppOnly(),
        NotificationPayload.builder().reservationId(reservationId).reminderOrdinal(2).build(),
        JobStatus.FAILED,
        FIXED_NOW,
        5,
        "SMTP auth rejected",
        NotificationErrorClass.AUTH,
        null,
        null,
        FIXED_NOW,
        FIXED_NOW);
  }
}
