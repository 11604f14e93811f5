/*
 * Where: Notification channel layer
 * What: SMS send path with provider modes, drill handling and hard-failure detection
 * Why: Invalid or unsubscribed numbers must fall back to email instead of burning retries
 */
package com.monsoonfire.notification.service.channel;

import com.monsoonfire.notification.config.SmsProperties;
import com.monsoonfire.notification.model.DrillMode;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.service.ContactResolver;
import com.monsoonfire.notification.service.NotificationContent;
import com.monsoonfire.notification.service.NotificationErrorClassifier;
import com.monsoonfire.notification.service.channel.DeliveryAttemptRecorder.SmsAttempt;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SmsChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(SmsChannelSender.class);
  private static final Set<String> HARD_FAILURE_CODES = Set.of("21211", "21610", "21612", "21614");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int PROVIDER_REASON_MAX = 180;

  private final SmsProperties properties;
  private final ContactResolver contactResolver;
  private final TwilioSmsClient twilioClient;
  private final DeliveryAttemptRecorder attemptRecorder;
  private final NotificationErrorClassifier errorClassifier;

  public SmsSendResult send(NotificationJob job, NotificationContent content) {
    final String mode = properties.providerMode().name().toLowerCase(Locale.ROOT);
    final Optional<String> phone = contactResolver.resolveSmsPhone(job.uid());
    if (phone.isEmpty()) {
      attemptRecorder.recordSms(job, skipped("PHONE_MISSING", mode, null));
      return SmsSendResult.skipped("PHONE_MISSING");
    }
    final String phoneE164 = phone.get();

    final DrillMode drillMode = job.payload() == null ? null : job.payload().drillMode();
    if (drillMode != null) {
      return simulate(
          job,
          phoneE164,
          mode,
          drillMode.name(),
          "DRILL_",
          drillMode == DrillMode.SUCCESS ? "DRILL_SUCCESS_SIMULATED" : null);
    }

    if (properties.providerMode() == SmsProperties.ProviderMode.DISABLED) {
      attemptRecorder.recordSms(job, skipped("SMS_PROVIDER_DISABLED", mode, phoneE164));
      return SmsSendResult.skipped("SMS_PROVIDER_DISABLED");
    }

    final String body = normalizeBody(content.textBody(), properties.maxBodyLength());
    if (body.isEmpty()) {
      attemptRecorder.recordSms(job, skipped("SMS_BODY_EMPTY", mode, phoneE164));
      return SmsSendResult.skipped("SMS_BODY_EMPTY");
    }

    if (properties.providerMode() == SmsProperties.ProviderMode.MOCK) {
      final SmsProperties.MockMode mockMode = properties.mockMode();
      return simulate(
          job,
          phoneE164,
          mode,
          mockMode.name(),
          "SMS_MOCK_",
          mockMode == SmsProperties.MockMode.SUCCESS ? "SMS_MOCK_SENT" : null);
    }

    return sendViaTwilio(job, phoneE164, body);
  }

  private SmsSendResult sendViaTwilio(NotificationJob job, String phoneE164, String body) {
    final TwilioSmsClient.TwilioResponse response = twilioClient.send(phoneE164, body);
    if (response.ok()) {
      attemptRecorder.recordSms(
          job,
          SmsAttempt.builder()
              .status("sent")
              .reason("SMS_PROVIDER_SENT")
              .provider(TwilioSmsClient.PROVIDER)
              .providerCode(response.twilioStatus())
              .phoneE164(phoneE164)
              .accepted(1)
              .rejected(0)
              .build());
      return SmsSendResult.sent(TwilioSmsClient.PROVIDER);
    }

    final NotificationErrorClass statusClass =
        errorClassifier.classifyHttpStatus(response.status());
    final String providerReason =
        truncate(
            response.status()
                + ":"
                + (response.providerCode() == null ? "no_code" : response.providerCode())
                + ":"
                + (response.providerMessage() == null ? "error" : response.providerMessage()),
            PROVIDER_REASON_MAX);
    final boolean hardFailure =
        statusClass == NotificationErrorClass.PROVIDER_4XX
            && isHardFailure(response.status(), response.providerCode());
    attemptRecorder.recordSms(
        job,
        SmsAttempt.builder()
            .status("failed")
            .reason((hardFailure ? "SMS_HARD_FAIL:" : "SMS_FAIL:") + providerReason)
            .provider(TwilioSmsClient.PROVIDER)
            .providerCode(response.providerCode())
            .phoneE164(phoneE164)
            .accepted(0)
            .rejected(1)
            .build());
    if (hardFailure) {
      logger.warn(
          "sms hard failure uid={} status={} providerCode={}",
          job.uid(),
          response.status(),
          response.providerCode());
      return SmsSendResult.hardFailed(providerReason, response.providerCode());
    }
    throw new ChannelDeliveryException(
        ChannelDeliveryException.Channel.SMS,
        statusClass,
        response.status(),
        response.providerCode(),
        "SMS provider failed (" + statusClass.wireName() + "): " + providerReason);
  }

  /**
   * Shared by drill and mock modes: success sends, provider_4xx hard-fails, every other mode
   * throws with the matching status.
   */
  private SmsSendResult simulate(
      NotificationJob job,
      String phoneE164,
      String provider,
      String modeName,
      String prefix,
      String successReason) {
    if (successReason != null) {
      attemptRecorder.recordSms(
          job,
          SmsAttempt.builder()
              .status("sent")
              .reason(successReason)
              .provider(provider)
              .phoneE164(phoneE164)
              .accepted(1)
              .rejected(0)
              .build());
      return SmsSendResult.sent(provider);
    }
    final String code = prefix + modeName;
    attemptRecorder.recordSms(
        job,
        SmsAttempt.builder()
            .status("failed")
            .reason(code)
            .provider(provider)
            .providerCode(code)
            .phoneE164(phoneE164)
            .accepted(0)
            .rejected(1)
            .build());
    return switch (modeName) {
      case "PROVIDER_4XX" -> SmsSendResult.hardFailed(code, code);
      case "AUTH" -> throw simulatedFailure(NotificationErrorClass.AUTH, 401, code);
      case "PROVIDER_5XX" -> throw simulatedFailure(NotificationErrorClass.PROVIDER_5XX, 503, code);
      default -> throw simulatedFailure(NotificationErrorClass.NETWORK, null, code);
    };
  }

  private ChannelDeliveryException simulatedFailure(
      NotificationErrorClass errorClass, Integer status, String code) {
    final String detail = status == null ? "network " + code : status + " " + code;
    return new ChannelDeliveryException(
        ChannelDeliveryException.Channel.SMS,
        errorClass,
        status,
        code,
        "SMS provider failed: " + detail);
  }

  static boolean isHardFailure(int status, String providerCode) {
    if (status < 400 || status >= 500 || status == 408 || status == 429) {
      return false;
    }
    return providerCode != null && HARD_FAILURE_CODES.contains(providerCode);
  }

  static String normalizeBody(String raw, int maxLength) {
    if (raw == null) {
      return "";
    }
    return truncate(WHITESPACE.matcher(raw).replaceAll(" ").trim(), maxLength);
  }

  private static SmsAttempt skipped(String reason, String provider, String phoneE164) {
    return SmsAttempt.builder()
        .status("skipped")
        .reason(reason)
        .provider(provider)
        .phoneE164(phoneE164)
        .accepted(0)
        .rejected(0)
        .build();
  }

  private static String truncate(String value, int maxLength) {
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }
}
