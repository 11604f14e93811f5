/*
 * Where: common event payload definitions
 * What: Kiln firing write event carrying the firing before and after the change
 * Why: Unload notifications fire on the unset-to-set transition of unloaded_at
 */
package com.monsoonfire.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record KilnFiringEventPayload(
    String eventId,
    String occurredAt,
    String firingId,
    KilnFiringDocument before,
    KilnFiringDocument after,
    String traceId) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record KilnFiringDocument(
      String kilnId,
      String kilnName,
      String cycleType,
      String unloadedAt,
      List<String> batchIds,
      List<String> pieceIds) {}
}
