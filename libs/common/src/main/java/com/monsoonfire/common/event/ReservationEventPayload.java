/*
 * Where: common event payload definitions
 * What: Reservation write event carrying the document before and after the change
 * Why: The reservation service and the notification service share one envelope shape
 */
package com.monsoonfire.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReservationEventPayload(
    String eventId,
    String occurredAt,
    String reservationId,
    ReservationDocument before,
    ReservationDocument after,
    String traceId) {}
