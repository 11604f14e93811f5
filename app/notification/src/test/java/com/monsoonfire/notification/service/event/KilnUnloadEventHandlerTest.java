package com.monsoonfire.notification.service.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.monsoonfire.common.event.KilnFiringEventPayload;
import com.monsoonfire.common.event.KilnFiringEventPayload.KilnFiringDocument;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.NotificationJobSpec;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPreferences;
import com.monsoonfire.notification.model.NotificationPreferences.EventToggles;
import com.monsoonfire.notification.model.SkipReason;
import com.monsoonfire.notification.repository.FiringOwnershipRepository;
import com.monsoonfire.notification.repository.NotificationPreferencesRepository;
import com.monsoonfire.notification.repository.ProcessedEventRepository;
import com.monsoonfire.notification.service.ContactResolver;
import com.monsoonfire.notification.service.NotificationJobEnqueuer;
import com.monsoonfire.notification.service.NotificationScheduleResolver;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KilnUnloadEventHandlerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final String UNLOADED_AT = "2026-01-16T23:30:00Z";

  @Mock private ProcessedEventRepository processedEventRepository;
  @Mock private FiringOwnershipRepository ownershipRepository;
  @Mock private NotificationPreferencesRepository preferencesRepository;
  @Mock private ContactResolver contactResolver;
  @Mock private NotificationJobEnqueuer enqueuer;
  @Captor private ArgumentCaptor<NotificationJobSpec> specCaptor;

  private KilnUnloadEventHandler handler;

  @BeforeEach
  void setUp() {
    handler =
        new KilnUnloadEventHandler(
            processedEventRepository,
            ownershipRepository,
            preferencesRepository,
            contactResolver,
            enqueuer,
            new NotificationScheduleResolver(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void unloadNotifiesEachMemberOwnerOnce() {
    when(processedEventRepository.insertIfAbsent("kiln", "evt-1", FIXED_NOW)).thenReturn(true);
    final Map<String, String> batchOwners = new LinkedHashMap<>();
    batchOwners.put("batch-1", "user-1");
    batchOwners.put("batch-2", "staff-1");
    when(ownershipRepository.findBatchOwners(List.of("batch-1", "batch-2")))
        .thenReturn(batchOwners);
    when(ownershipRepository.findBatchIdsForPieces(List.of("piece-9")))
        .thenReturn(Map.of("piece-9", "batch-3"));
    when(ownershipRepository.findBatchOwners(Set.of("batch-3")))
        .thenReturn(Map.of("batch-3", "user-1"));
    when(contactResolver.isStaff("user-1")).thenReturn(false);
    when(contactResolver.isStaff("staff-1")).thenReturn(true);
    when(preferencesRepository.findByUid("user-1")).thenReturn(NotificationPreferences.defaults());
    when(enqueuer.enqueue(any(NotificationJobSpec.class))).thenReturn(true);

    final int created =
        handler.handle(
            event(
                null,
                unloaded(
                    " Glaze ",
                    List.of("batch-1", " batch-2 ", "batch-1", ""),
                    List.of("piece-9"))));

    assertThat(created).isEqualTo(1);
    verify(enqueuer).enqueue(specCaptor.capture());
    final NotificationJobSpec spec = specCaptor.getValue();
    assertThat(spec.type()).isEqualTo(NotificationJobType.KILN_UNLOADED);
    assertThat(spec.uid()).isEqualTo("user-1");
    assertThat(spec.dedupeKey()).isEqualTo("KILN_UNLOADED:firing-1:user-1");
    assertThat(spec.channels()).isEqualTo(DeliveryChannels.inAppOnly());
    assertThat(spec.runAfter()).isEqualTo(FIXED_NOW);
    assertThat(spec.skipReason()).isNull();
    assertThat(spec.payload().kilnName()).isEqualTo("Kiln A");
    assertThat(spec.payload().firingType()).isEqualTo("glaze");
    assertThat(spec.payload().batchIds()).containsExactly("batch-1");
    assertThat(spec.payload().pieceIds()).containsExactly("piece-9");
  }

  @Test
  void disabledFiringTypeCreatesSkippedJob() {
    when(processedEventRepository.insertIfAbsent("kiln", "evt-1", FIXED_NOW)).thenReturn(true);
    when(ownershipRepository.findBatchOwners(List.of("batch-1")))
        .thenReturn(Map.of("batch-1", "user-1"));
    when(preferencesRepository.findByUid("user-1"))
        .thenReturn(
            new NotificationPreferences(
                true,
                DeliveryChannels.inAppOnly(),
                new EventToggles(true, true, false),
                NotificationPreferences.QuietHours.disabled(),
                NotificationPreferences.defaults().frequency()));
    when(enqueuer.enqueue(any(NotificationJobSpec.class))).thenReturn(true);

    handler.handle(event(null, unloaded("glaze", List.of("batch-1"), List.of())));

    verify(enqueuer).enqueue(specCaptor.capture());
    assertThat(specCaptor.getValue().skipReason()).isEqualTo(SkipReason.PREFS_DISABLED);
    assertThat(specCaptor.getValue().channels()).isEqualTo(DeliveryChannels.none());
  }

  @Test
  void kilnNameFallsBackToKilnLookup() {
    when(processedEventRepository.insertIfAbsent("kiln", "evt-1", FIXED_NOW)).thenReturn(true);
    when(ownershipRepository.findBatchOwners(List.of("batch-1")))
        .thenReturn(Map.of("batch-1", "user-1"));
    when(ownershipRepository.findKilnName("kiln-1")).thenReturn(Optional.of("Big Kiln"));
    when(preferencesRepository.findByUid("user-1")).thenReturn(NotificationPreferences.defaults());

    handler.handle(
        event(
            null,
            new KilnFiringDocument(
                "kiln-1", " ", "bisque", UNLOADED_AT, List.of("batch-1"), List.of())));

    verify(enqueuer).enqueue(specCaptor.capture());
    assertThat(specCaptor.getValue().payload().kilnName()).isEqualTo("Big Kiln");
    assertThat(specCaptor.getValue().payload().firingType()).isEqualTo("bisque");
  }

  @Test
  void laterWritesToAnUnloadedFiringDoNotNotify() {
    final int created =
        handler.handle(
            event(
                unloaded("glaze", List.of("batch-1"), List.of()),
                unloaded("glaze", List.of("batch-1", "batch-2"), List.of())));

    assertThat(created).isZero();
    verifyNoInteractions(processedEventRepository, ownershipRepository, enqueuer);
  }

  @Test
  void firingStillInKilnDoesNotNotify() {
    final KilnFiringDocument loading =
        new KilnFiringDocument("kiln-1", "Kiln A", "glaze", null, List.of("batch-1"), List.of());

    assertThat(handler.handle(event(null, loading))).isZero();
    verifyNoInteractions(processedEventRepository, enqueuer);
  }

  @Test
  void redeliveredEventIsIgnored() {
    when(processedEventRepository.insertIfAbsent("kiln", "evt-1", FIXED_NOW)).thenReturn(false);

    assertThat(handler.handle(event(null, unloaded("glaze", List.of("batch-1"), List.of()))))
        .isZero();
    verifyNoInteractions(ownershipRepository, enqueuer);
  }

  @Test
  void unownedFiringCreatesNothing() {
    when(processedEventRepository.insertIfAbsent("kiln", "evt-1", FIXED_NOW)).thenReturn(true);
    when(ownershipRepository.findBatchOwners(List.of("batch-1"))).thenReturn(Map.of());

    assertThat(handler.handle(event(null, unloaded("glaze", List.of("batch-1"), List.of()))))
        .isZero();
    verifyNoInteractions(enqueuer);
  }

  @Test
  void missingFiringIdIsPermanent() {
    final KilnFiringEventPayload event =
        new KilnFiringEventPayload(
            "evt-1", UNLOADED_AT, null, null, unloaded("glaze", List.of(), List.of()), "trace-1");

    assertThatThrownBy(() -> handler.handle(event))
        .isInstanceOf(NotificationEventPermanentException.class)
        .hasMessageContaining("firing_id");
  }

  @Test
  void firingTypeOutsideBisqueAndGlazeIsDropped() {
    assertThat(KilnUnloadEventHandler.normalizeFiringType("raku")).isNull();
    assertThat(KilnUnloadEventHandler.normalizeFiringType(null)).isNull();
    assertThat(KilnUnloadEventHandler.normalizeFiringType(" BISQUE")).isEqualTo("bisque");
  }

  private static KilnFiringEventPayload event(KilnFiringDocument before, KilnFiringDocument after) {
    return new KilnFiringEventPayload("evt-1", UNLOADED_AT, "firing-1", before, after, "trace-1");
  }

  private static KilnFiringDocument unloaded(
      String cycleType, List<String> batchIds, List<String> pieceIds) {
    return new KilnFiringDocument("kiln-1", "Kiln A", cycleType, UNLOADED_AT, batchIds, pieceIds);
  }
}
