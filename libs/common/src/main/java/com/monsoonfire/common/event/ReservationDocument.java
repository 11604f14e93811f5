/*
 * Where: common event payload definitions
 * What: Raw reservation document as written by the reservation service
 * Why: Timestamps stay ISO-8601 strings so either side can evolve without a shared time library
 */
package com.monsoonfire.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReservationDocument(
    String ownerUid,
    String status,
    String loadStatus,
    String createdAt,
    String updatedAt,
    EstimatedWindowDocument estimatedWindow,
    String stageReason,
    String stageNotes,
    String staffNotes,
    String readyForPickupAt,
    PickupWindowDocument pickupWindow) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record EstimatedWindowDocument(
      String currentStart,
      String currentEnd,
      String updatedAt,
      String slaState,
      String confidence) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PickupWindowDocument(
      String requestedStart,
      String requestedEnd,
      String confirmedStart,
      String confirmedEnd,
      String status,
      String confirmedAt,
      String completedAt,
      Integer missedCount,
      Integer rescheduleCount) {}
}
