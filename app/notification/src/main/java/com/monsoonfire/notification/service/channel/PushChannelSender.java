/*
 * Where: Notification channel layer
 * What: Push send path: active tokens, one relay call, invalid-token deactivation, telemetry
 * Why: Per-token rejection is not a job failure; only a failed relay call is
 */
package com.monsoonfire.notification.service.channel;

import com.monsoonfire.notification.config.PushRelayProperties;
import com.monsoonfire.notification.model.DeviceToken;
import com.monsoonfire.notification.model.DrillMode;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.repository.DeviceTokenRepository;
import com.monsoonfire.notification.service.NotificationContent;
import com.monsoonfire.notification.service.channel.PushRelayClient.PushNotification;
import com.monsoonfire.notification.service.channel.PushRelayClient.PushRelayResult;
import com.monsoonfire.notification.service.channel.PushRelayClient.TokenResult;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PushChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(PushChannelSender.class);
  private static final Set<String> INVALID_TOKEN_CODES =
      Set.of("baddevicetoken", "unregistered", "device_token_not_for_topic");
  private static final int MAX_REASON_LENGTH = 180;

  private final PushRelayProperties properties;
  private final DeviceTokenRepository deviceTokenRepository;
  private final PushRelayClient relayClient;
  private final DeliveryAttemptRecorder attemptRecorder;
  private final Clock clock;

  public void send(NotificationJob job, NotificationContent content) {
    final DrillMode drillMode = job.payload() == null ? null : job.payload().drillMode();
    if (drillMode != null) {
      simulateDrill(job, drillMode);
      return;
    }

    final List<DeviceToken> tokens =
        deviceTokenRepository.findActiveByUid(job.uid(), properties.maxTokens()).stream()
            .filter(token -> token.token() != null && !token.token().isBlank())
            .toList();
    if (tokens.isEmpty()) {
      attemptRecorder.recordPush(
          job, List.of(), "skipped", "NO_ACTIVE_DEVICE_TOKENS", null, null, null, List.of());
      return;
    }
    final List<String> tokenHashes = tokens.stream().map(DeviceToken::tokenHash).toList();

    final PushRelayResult result;
    try {
      result = relayClient.send(tokens, toNotification(job, content), context(job));
    } catch (RuntimeException ex) {
      final String message = ex.getMessage() == null ? "push relay failed" : ex.getMessage();
      attemptRecorder.recordPush(
          job,
          tokenHashes,
          "failed",
          message.length() > MAX_REASON_LENGTH ? message.substring(0, MAX_REASON_LENGTH) : message,
          PushRelayClient.PROVIDER,
          0,
          tokens.size(),
          List.of());
      throw ex;
    }

    deactivateInvalidTokens(job.uid(), result.results());
    final List<String> failedCodes =
        result.results().stream()
            .filter(entry -> !entry.ok() && entry.providerCode() != null)
            .map(TokenResult::providerCode)
            .toList();
    attemptRecorder.recordPush(
        job,
        tokenHashes,
        result.rejected() > 0 && result.accepted() == 0 ? "failed" : "sent",
        result.rejected() > 0 ? "PUSH_PROVIDER_PARTIAL" : "PUSH_PROVIDER_SENT",
        result.provider(),
        result.accepted(),
        result.rejected(),
        failedCodes);
  }

  private void deactivateInvalidTokens(String uid, List<TokenResult> results) {
    final Instant now = Instant.now(clock);
    for (TokenResult entry : results) {
      if (entry.ok() || !isInvalidTokenCode(entry.providerCode())) {
        continue;
      }
      final int updated =
          deviceTokenRepository.deactivate(
              uid, List.of(entry.tokenHash()), entry.providerCode(), now);
      if (updated > 0) {
        logger.info(
            "device token deactivated uid={} tokenHash={} providerCode={}",
            uid,
            entry.tokenHash(),
            entry.providerCode());
      }
    }
  }

  static boolean isInvalidTokenCode(String providerCode) {
    return providerCode != null
        && INVALID_TOKEN_CODES.contains(providerCode.toLowerCase(Locale.ROOT));
  }

  private void simulateDrill(NotificationJob job, DrillMode drillMode) {
    switch (drillMode) {
      case AUTH -> throw drillFailure(
          NotificationErrorClass.AUTH, 401, "APNS relay failed: 401 DRILL_AUTH");
      case PROVIDER_4XX -> throw drillFailure(
          NotificationErrorClass.PROVIDER_4XX, 400, "APNS relay failed: 400 DRILL_PROVIDER_4XX");
      case PROVIDER_5XX -> throw drillFailure(
          NotificationErrorClass.PROVIDER_5XX, 503, "APNS relay failed: 503 DRILL_PROVIDER_5XX");
      case NETWORK -> throw drillFailure(
          NotificationErrorClass.NETWORK, null, "push relay network failure DRILL_NETWORK");
      case SUCCESS -> attemptRecorder.recordPush(
          job,
          List.of(),
          "sent",
          "DRILL_SUCCESS_SIMULATED",
          PushRelayClient.PROVIDER,
          1,
          0,
          List.of());
    }
  }

  private static ChannelDeliveryException drillFailure(
      NotificationErrorClass errorClass, Integer status, String message) {
    return new ChannelDeliveryException(
        ChannelDeliveryException.Channel.PUSH, errorClass, status, null, message);
  }

  private static PushNotification toNotification(NotificationJob job, NotificationContent content) {
    final NotificationPayload payload = job.payload();
    final Map<String, String> data = new LinkedHashMap<>();
    data.put("type", content.messageType());
    data.put("firingId", orEmpty(payload.firingId()));
    data.put("kilnId", orEmpty(payload.kilnId()));
    data.put("kilnName", orEmpty(payload.kilnName()));
    data.put("firingType", orEmpty(payload.firingType()));
    data.put("reservationId", orEmpty(payload.reservationId()));
    data.put("reservationStatus", orEmpty(payload.reservationStatus()));
    data.put("eventKind", payload.eventKind() == null ? "" : payload.eventKind().wireName());
    data.put("sourceKind", orEmpty(content.sourceKind()));
    data.put("sourceId", orEmpty(content.sourceId()));
    return new PushNotification(content.title(), content.body(), data);
  }

  private static Map<String, String> context(NotificationJob job) {
    final Map<String, String> context = new LinkedHashMap<>();
    context.put("uid", job.uid());
    context.put("dedupeKey", job.dedupeKey());
    context.put("firingId", orEmpty(job.payload().firingId()));
    return context;
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
