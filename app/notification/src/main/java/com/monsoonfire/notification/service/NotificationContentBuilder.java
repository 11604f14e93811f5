/*
 * Where: Notification service layer
 * What: Builds titles, bodies, subjects and message types for kiln and reservation jobs
 * Why: In-app, email, push and SMS all render from the same copy
 */
package com.monsoonfire.notification.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.config.NotificationContentProperties;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.ReservationEventKind;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationContentBuilder {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final DateTimeFormatter USER_FORMAT =
      DateTimeFormatter.ofPattern("MMM d, h:mm a", Locale.US);

  private final ObjectMapper objectMapper;
  private final NotificationContentProperties properties;

  public NotificationContent build(NotificationJob job) {
    if (job.type() == NotificationJobType.KILN_UNLOADED) {
      return buildKilnContent(job.payload());
    }
    return buildReservationContent(job);
  }

  private NotificationContent buildKilnContent(NotificationPayload payload) {
    final String title =
        isBlank(payload.kilnName()) ? "Kiln unloaded" : "Kiln unloaded: " + payload.kilnName();
    final boolean hasType = !isBlank(payload.firingType());
    final String body =
        hasType
            ? "Your " + payload.firingType()
                + " firing is unloaded. We will confirm details together at pickup."
            : "Your firing is unloaded. We will confirm details together at pickup.";
    final String textBody =
        String.join(
            "\n",
            "Your firing has been unloaded.",
            "Firing" + (hasType ? " (" + payload.firingType() + ")" : ""),
            "We will confirm everything together at pickup.");
    final Map<String, Object> data = new LinkedHashMap<>();
    putIfPresent(data, "firingId", payload.firingId());
    putIfPresent(data, "kilnId", payload.kilnId());
    putIfPresent(data, "kilnName", payload.kilnName());
    putIfPresent(data, "firingType", payload.firingType());
    data.put("batchIds", payload.batchIds() == null ? List.of() : payload.batchIds());
    data.put("pieceIds", payload.pieceIds() == null ? List.of() : payload.pieceIds());
    return new NotificationContent(
        "KILN_UNLOADED", title, body, title, textBody, "firing", payload.firingId(), data);
  }

  private NotificationContent buildReservationContent(NotificationJob job) {
    final NotificationPayload payload = job.payload();
    final String estimateLine = estimateLine(payload);
    final String reasonLine = reasonLine(payload);
    final String nextLine = nextUpdateLine(payload);
    final String supportLine =
        "Contact support with code " + DedupeHashes.supportCode(job.dedupeKey());
    final ReservationEventKind kind =
        payload.eventKind() == null ? ReservationEventKind.ESTIMATE_SHIFT : payload.eventKind();

    final Copy copy =
        switch (kind) {
          case CONFIRMED -> new Copy(
              "Reservation confirmed",
              "Reservation confirmed",
              "RESERVATION_CONFIRMED",
              join("Your reservation is confirmed.", estimateLine, reasonLine, nextLine));
          case WAITLISTED -> new Copy(
              "Reservation waitlisted",
              "Reservation moved to waitlist",
              "RESERVATION_WAITLISTED",
              join(
                  "Your reservation is currently waitlisted.", estimateLine, reasonLine, nextLine));
          case CANCELLED -> new Copy(
              "Reservation cancelled",
              "Reservation cancelled",
              "RESERVATION_CANCELLED",
              join(
                  "Your reservation has been cancelled.",
                  reasonLine,
                  supportLine + " if this looks wrong."));
          case PICKUP_READY -> new Copy(
              "Ready for pickup",
              "Reservation ready for pickup",
              "RESERVATION_READY_PICKUP",
              join("Your reservation is ready for pickup planning.", reasonLine, nextLine));
          case DELAY_FOLLOW_UP -> new Copy(
              "Reservation delay update",
              "Reservation delay follow-up",
              "RESERVATION_DELAY_FOLLOW_UP",
              join("Your reservation is still delayed.", estimateLine, reasonLine, nextLine));
          case PICKUP_REMINDER -> new Copy(
              "Pickup reminder",
              "Reservation pickup reminder",
              "RESERVATION_PICKUP_REMINDER",
              join(
                  "Your reservation is still waiting for pickup.",
                  reasonLine,
                  nextLine,
                  supportLine + " if you need help scheduling pickup."));
          case ESTIMATE_SHIFT -> new Copy(
              "Reservation estimate updated",
              "Reservation estimate updated",
              "RESERVATION_ESTIMATE_SHIFT",
              join("Your reservation estimate has changed.", estimateLine, reasonLine, nextLine));
        };

    final Map<String, Object> data = objectMapper.convertValue(payload, MAP_TYPE);
    data.remove("dedupeKey");
    final String sourceId =
        isBlank(payload.reservationId()) ? payload.firingId() : payload.reservationId();
    return new NotificationContent(
        copy.messageType(),
        copy.title(),
        copy.body(),
        copy.subject(),
        copy.body(),
        "reservation",
        sourceId,
        data);
  }

  private String estimateLine(NotificationPayload payload) {
    final String start = formatForUser(payload.currentWindowStartIso());
    final String end = formatForUser(payload.currentWindowEndIso());
    if (start != null && end != null) {
      return "Updated estimate: " + start + " - " + end + ".";
    }
    if (!isBlank(payload.estimateWindowLabel())) {
      return "Updated estimate: " + payload.estimateWindowLabel() + ".";
    }
    return "Updated estimate: We'll keep this current as queue conditions change.";
  }

  private String reasonLine(NotificationPayload payload) {
    if (!isBlank(payload.reason())) {
      return "Last change reason: " + payload.reason().trim() + ".";
    }
    return "Last change reason: queue and kiln availability were recalculated.";
  }

  private String nextUpdateLine(NotificationPayload payload) {
    if (!isBlank(payload.policyWindowLabel())) {
      return payload.policyWindowLabel().trim();
    }
    final String next = formatForUser(payload.suggestedNextUpdateAtIso());
    if (next != null) {
      return "Suggested next update window: around " + next + ".";
    }
    return "Suggested next update window: within 24 hours or sooner if conditions change.";
  }

  public String formatForUser(String iso) {
    if (isBlank(iso)) {
      return null;
    }
    try {
      return USER_FORMAT.format(Instant.parse(iso).atZone(properties.timeZone()));
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static String join(String... lines) {
    return String.join(" ", lines);
  }

  private static void putIfPresent(Map<String, Object> data, String key, String value) {
    if (value != null) {
      data.put(key, value);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record Copy(String title, String subject, String messageType, String body) {}
}
