/*
 * Where: Notification event handling
 * What: Creates one kiln-unload job per member whose batches or pieces were in the firing
 * Why: Only the unset-to-set transition of unloaded_at notifies; later writes to the firing do not
 */
package com.monsoonfire.notification.service.event;

import com.monsoonfire.common.event.KilnFiringEventPayload;
import com.monsoonfire.common.event.KilnFiringEventPayload.KilnFiringDocument;
import com.monsoonfire.notification.model.NotificationJobSpec;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.NotificationPreferences;
import com.monsoonfire.notification.model.SkipReason;
import com.monsoonfire.notification.repository.FiringOwnershipRepository;
import com.monsoonfire.notification.repository.NotificationPreferencesRepository;
import com.monsoonfire.notification.repository.ProcessedEventRepository;
import com.monsoonfire.notification.service.ContactResolver;
import com.monsoonfire.notification.service.NotificationJobEnqueuer;
import com.monsoonfire.notification.service.NotificationScheduleResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class KilnUnloadEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(KilnUnloadEventHandler.class);
  static final String EVENT_SOURCE = "kiln";

  private final ProcessedEventRepository processedEventRepository;
  private final FiringOwnershipRepository ownershipRepository;
  private final NotificationPreferencesRepository preferencesRepository;
  private final ContactResolver contactResolver;
  private final NotificationJobEnqueuer enqueuer;
  private final NotificationScheduleResolver scheduleResolver;
  private final Clock clock;

  /** Returns the number of jobs created. */
  @Transactional
  public int handle(KilnFiringEventPayload event) {
    final String firingId = requireText(event.firingId(), "firing_id");
    final String eventId = requireText(event.eventId(), "event_id");
    final KilnFiringDocument after = event.after();
    if (after == null || isBlank(after.unloadedAt())) {
      return 0;
    }
    if (event.before() != null && !isBlank(event.before().unloadedAt())) {
      return 0;
    }
    final Instant now = Instant.now(clock);
    if (!processedEventRepository.insertIfAbsent(EVENT_SOURCE, eventId, now)) {
      logger.debug("kiln event already processed eventId={}", eventId);
      return 0;
    }

    final List<String> batchIds = cleanIds(after.batchIds());
    final List<String> pieceIds = cleanIds(after.pieceIds());
    final Map<String, OwnedWork> owners = resolveOwners(batchIds, pieceIds);
    if (owners.isEmpty()) {
      logger.warn(
          "kiln unload notification skipped: no owners firingId={} batchIds={} pieceIds={}",
          firingId,
          batchIds.size(),
          pieceIds.size());
      return 0;
    }

    final String kilnId = trimToNull(after.kilnId());
    final String kilnName =
        !isBlank(after.kilnName())
            ? after.kilnName().trim()
            : kilnId == null ? null : ownershipRepository.findKilnName(kilnId).orElse(null);
    final String firingType = normalizeFiringType(after.cycleType());
    logger.info(
        "kiln unload notification queued firingId={} owners={} kilnName={} firingType={}",
        firingId,
        owners.size(),
        kilnName,
        firingType);

    int created = 0;
    for (Map.Entry<String, OwnedWork> entry : owners.entrySet()) {
      final String uid = entry.getKey();
      if (contactResolver.isStaff(uid)) {
        logger.info(
            "notification recipient skipped by audience segment uid={} firingId={}", uid, firingId);
        continue;
      }
      final OwnedWork owned = entry.getValue();
      final String dedupeKey = "KILN_UNLOADED:" + firingId + ":" + uid;
      final NotificationPayload payload =
          NotificationPayload.builder()
              .firingId(firingId)
              .kilnId(kilnId)
              .kilnName(kilnName)
              .firingType(firingType)
              .batchIds(owned.batchIds().isEmpty() ? batchIds : owned.batchIds())
              .pieceIds(owned.pieceIds().isEmpty() ? pieceIds : owned.pieceIds())
              .build();
      final NotificationPreferences preferences = preferencesRepository.findByUid(uid);
      final NotificationJobSpec spec =
          preferences.allowsKilnUnload(firingType)
              ? NotificationJobSpec.queued(
                  NotificationJobType.KILN_UNLOADED,
                  uid,
                  dedupeKey,
                  preferences.channels(),
                  payload,
                  scheduleResolver.resolveRunAfter(now, preferences))
              : NotificationJobSpec.skipped(
                  NotificationJobType.KILN_UNLOADED,
                  uid,
                  dedupeKey,
                  payload,
                  SkipReason.PREFS_DISABLED);
      if (enqueuer.enqueue(spec)) {
        created++;
      }
    }
    return created;
  }

  /** Batch owners first, then piece owners through the piece's batch; ids kept per owner. */
  private Map<String, OwnedWork> resolveOwners(List<String> batchIds, List<String> pieceIds) {
    final Map<String, OwnedWork> owners = new LinkedHashMap<>();
    ownershipRepository
        .findBatchOwners(batchIds)
        .forEach((batchId, ownerUid) -> ownedBy(owners, ownerUid).addBatch(batchId));
    if (pieceIds.isEmpty()) {
      return owners;
    }
    final Map<String, String> pieceBatches = ownershipRepository.findBatchIdsForPieces(pieceIds);
    final Map<String, String> pieceBatchOwners =
        ownershipRepository.findBatchOwners(new LinkedHashSet<>(pieceBatches.values()));
    pieceBatches.forEach(
        (pieceId, batchId) -> {
          final String ownerUid = pieceBatchOwners.get(batchId);
          if (ownerUid != null) {
            ownedBy(owners, ownerUid).addPiece(pieceId);
          }
        });
    return owners;
  }

  private static OwnedWork ownedBy(Map<String, OwnedWork> owners, String ownerUid) {
    return owners.computeIfAbsent(ownerUid, key -> new OwnedWork());
  }

  static String normalizeFiringType(String cycleType) {
    final String normalized = cycleType == null ? "" : cycleType.trim().toLowerCase(Locale.ROOT);
    return "bisque".equals(normalized) || "glaze".equals(normalized) ? normalized : null;
  }

  private static List<String> cleanIds(List<String> ids) {
    if (ids == null) {
      return List.of();
    }
    return ids.stream().filter(id -> !isBlank(id)).map(String::trim).distinct().toList();
  }

  private static String requireText(String value, String field) {
    if (isBlank(value)) {
      throw new NotificationEventPermanentException("missing kiln event " + field);
    }
    return value.trim();
  }

  private static String trimToNull(String value) {
    return isBlank(value) ? null : value.trim();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static final class OwnedWork {
    private final List<String> batchIds = new ArrayList<>();
    private final List<String> pieceIds = new ArrayList<>();

    private void addBatch(String batchId) {
      if (!batchIds.contains(batchId)) {
        batchIds.add(batchId);
      }
    }

    private void addPiece(String pieceId) {
      if (!pieceIds.contains(pieceId)) {
        pieceIds.add(pieceId);
      }
    }

    private List<String> batchIds() {
      return batchIds;
    }

    private List<String> pieceIds() {
      return pieceIds;
    }
  }
}
