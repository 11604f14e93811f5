/*
 * Where: Notification model
 * What: Event-specific fields carried by a notification job
 * Why: The queue engine treats the payload as opaque; only content builders and eligibility
 *      checks read it
 */
package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationPayload(
    String dedupeKey,
    String firingId,
    String kilnId,
    String kilnName,
    String firingType,
    List<String> batchIds,
    List<String> pieceIds,
    DrillMode drillMode,
    String reservationId,
    String reservationStatus,
    String previousReservationStatus,
    String reservationLoadStatus,
    String previousReservationLoadStatus,
    ReservationEventKind eventKind,
    String reason,
    String estimateWindowLabel,
    String suggestedNextUpdateAtIso,
    String previousWindowStartIso,
    String previousWindowEndIso,
    String currentWindowStartIso,
    String currentWindowEndIso,
    String delayEpisodeId,
    Integer delayFollowUpOrdinal,
    StorageStatus storageStatus,
    StorageStatus previousStorageStatus,
    Integer reminderOrdinal,
    Integer reminderCount,
    String readyForPickupAtIso,
    String policyWindowLabel) {

  public NotificationPayload {
    batchIds = batchIds == null ? null : List.copyOf(batchIds);
    pieceIds = pieceIds == null ? null : List.copyOf(pieceIds);
  }
}
