/*
 * Where: Notification channel layer
 * What: Writes SMS and push attempt telemetry rows
 * Why: The attempt id is derived from the outcome, so retries of the same outcome overwrite instead
 *      of piling up rows
 */
package com.monsoonfire.notification.service.channel;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.model.DeliveryAttempt;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.repository.DeliveryAttemptRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryAttemptRecorder {

  static final String SMS = "sms";
  static final String PUSH = "push";

  private final DeliveryAttemptRepository repository;
  private final Clock clock;

  public void recordSms(NotificationJob job, SmsAttempt attempt) {
    final String attemptId =
        DedupeHashes.sha256Hex(
            job.dedupeKey()
                + ":sms:"
                + attempt.status()
                + ":"
                + attempt.reason()
                + ":"
                + orNone(attempt.providerCode())
                + ":"
                + orNone(attempt.fallbackStatus()));
    repository.upsert(
        base(job, attemptId, SMS)
            .status(attempt.status())
            .reason(attempt.reason())
            .provider(attempt.provider())
            .providerCode(attempt.providerCode())
            .phoneHash(
                attempt.phoneE164() == null ? null : DedupeHashes.sha256Hex(attempt.phoneE164()))
            .accepted(attempt.accepted())
            .rejected(attempt.rejected())
            .fallbackChannel(attempt.fallbackStatus() == null ? null : "email")
            .fallbackStatus(attempt.fallbackStatus())
            .build());
  }

  public void recordPush(
      NotificationJob job,
      List<String> tokenHashes,
      String status,
      String reason,
      String provider,
      Integer accepted,
      Integer rejected,
      List<String> providerCodes) {
    final String attemptId = DedupeHashes.sha256Hex(job.dedupeKey() + ":push:" + reason);
    repository.upsert(
        base(job, attemptId, PUSH)
            .tokenHashes(tokenHashes)
            .status(status)
            .reason(reason)
            .provider(provider)
            .providerCode(
                providerCodes == null || providerCodes.isEmpty()
                    ? null
                    : String.join(",", providerCodes))
            .accepted(accepted)
            .rejected(rejected)
            .build());
  }

  private DeliveryAttempt.DeliveryAttemptBuilder base(
      NotificationJob job, String attemptId, String channel) {
    return DeliveryAttempt.builder()
        .attemptId(attemptId)
        .uid(job.uid())
        .channel(channel)
        .jobType(job.type())
        .dedupeKey(job.dedupeKey())
        .reservationId(job.reservationId())
        .firingId(job.payload() == null ? null : job.payload().firingId())
        .createdAt(Instant.now(clock));
  }

  private static String orNone(String value) {
    return value == null ? "none" : value;
  }

  /** One SMS telemetry row; {@code fallbackStatus} is set only for the email fallback outcome. */
  @Builder
  public record SmsAttempt(
      String status,
      String reason,
      String provider,
      String providerCode,
      String phoneE164,
      Integer accepted,
      Integer rejected,
      String fallbackStatus) {}
}
