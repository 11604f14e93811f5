/*
 * Where: Notification channel layer
 * What: Sends one job over its enabled channels in a fixed order: in-app, SMS, email, push
 * Why: Sequential sends keep the SMS-to-email fallback decision local and make every failure
 *      attributable to one channel
 */
package com.monsoonfire.notification.service.channel;

import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.service.ContactResolver;
import com.monsoonfire.notification.service.NotificationContent;
import com.monsoonfire.notification.service.NotificationContentBuilder;
import com.monsoonfire.notification.service.NotificationMetrics;
import com.monsoonfire.notification.service.channel.DeliveryAttemptRecorder.SmsAttempt;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChannelDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDispatcher.class);
  private static final int WARNING_REASON_MAX = 120;

  private final NotificationContentBuilder contentBuilder;
  private final InAppChannelSender inAppSender;
  private final SmsChannelSender smsSender;
  private final EmailChannelSender emailSender;
  private final PushChannelSender pushSender;
  private final ContactResolver contactResolver;
  private final DeliveryAttemptRecorder attemptRecorder;
  private final NotificationMetrics metrics;

  /**
   * Returns soft warnings for the job's last_error. Any exception thrown here is a channel failure
   * for the queue engine to classify.
   */
  public List<String> dispatch(NotificationJob job, DeliveryChannels channels) {
    final NotificationContent content = contentBuilder.build(job);
    final List<String> warnings = new ArrayList<>();

    if (channels.inApp()) {
      inAppSender.send(job, content);
    }

    boolean smsFallback = false;
    if (channels.sms()) {
      final SmsSendResult sms = smsSender.send(job, content);
      metrics.recordSmsOutcome(sms.outcome().name().toLowerCase(Locale.ROOT));
      if (sms.outcome() == SmsSendResult.Outcome.HARD_FAILED) {
        smsFallback = true;
        warnings.add("SMS_HARD_FAIL:" + truncate(sms.reason(), WARNING_REASON_MAX));
      } else if (sms.outcome() == SmsSendResult.Outcome.SKIPPED) {
        warnings.add("SMS_SKIPPED:" + sms.reason());
      }
    }

    if (channels.email() || smsFallback) {
      sendEmail(job, content, smsFallback, warnings);
    }

    if (channels.push()) {
      pushSender.send(job, content);
    }
    return warnings;
  }

  private void sendEmail(
      NotificationJob job,
      NotificationContent content,
      boolean smsFallback,
      List<String> warnings) {
    final Optional<String> email = contactResolver.resolveEmail(job.uid());
    if (email.isEmpty()) {
      if (smsFallback) {
        warnings.add("SMS_FALLBACK_EMAIL_MISSING");
        attemptRecorder.recordSms(
            job, fallback("failed", "SMS_FALLBACK_EMAIL_MISSING", "missing_email"));
      } else {
        warnings.add("EMAIL_MISSING");
      }
      logger.warn(
          "email notification skipped without address uid={} jobId={} fallback={}",
          job.uid(),
          job.jobId(),
          smsFallback);
      return;
    }
    try {
      emailSender.send(job, content, email.get());
    } catch (RuntimeException ex) {
      if (smsFallback) {
        attemptRecorder.recordSms(
            job,
            fallback(
                "failed",
                "SMS_FALLBACK_EMAIL_FAILED:"
                    + truncate(String.valueOf(ex.getMessage()), WARNING_REASON_MAX),
                "failed"));
      }
      throw ex;
    }
    if (smsFallback) {
      warnings.add("SMS_FALLBACK_EMAIL_SENT");
      attemptRecorder.recordSms(job, fallback("sent", "SMS_FALLBACK_EMAIL_SENT", "sent"));
    }
  }

  private static SmsAttempt fallback(String status, String reason, String fallbackStatus) {
    return SmsAttempt.builder()
        .status(status)
        .reason(reason)
        .fallbackStatus(fallbackStatus)
        .build();
  }

  private static String truncate(String value, int maxLength) {
    if (value == null) {
      return "";
    }
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }
}
