/*
 * Where: Notification channel layer tests
 * What: Channel order and the SMS hard-failure fallback to email
 * Why: A hard SMS failure must still reach the user once, through email, and be recorded
 */
package com.monsoonfire.notification.service.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.JobStatus;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.service.ContactResolver;
import com.monsoonfire.notification.service.NotificationContent;
import com.monsoonfire.notification.service.NotificationContentBuilder;
import com.monsoonfire.notification.service.NotificationMetrics;
import com.monsoonfire.notification.service.channel.DeliveryAttemptRecorder.SmsAttempt;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChannelDispatcherTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final DeliveryChannels SMS_ONLY = new DeliveryChannels(false, false, false, true);
  private static final NotificationContent CONTENT =
      new NotificationContent(
          "KILN_UNLOADED",
          "Kiln unloaded",
          "Your pieces are out of the kiln.",
          "Kiln unloaded",
          "Your pieces are out of the kiln.",
          "firing",
          "firing-1",
          Map.of());

  @Mock private NotificationContentBuilder contentBuilder;
  @Mock private InAppChannelSender inAppSender;
  @Mock private SmsChannelSender smsSender;
  @Mock private EmailChannelSender emailSender;
  @Mock private PushChannelSender pushSender;
  @Mock private ContactResolver contactResolver;
  @Mock private DeliveryAttemptRecorder attemptRecorder;
  @Mock private NotificationMetrics metrics;

  private ChannelDispatcher dispatcher;
  private NotificationJob job;

  @BeforeEach
  void setUp() {
    dispatcher =
        new ChannelDispatcher(
            contentBuilder,
            inAppSender,
            smsSender,
            emailSender,
            pushSender,
            contactResolver,
            attemptRecorder,
            metrics);
    job =
        new NotificationJob(
            "job-1",
            "KILN_UNLOADED:firing-1:user-1",
            NotificationJobType.KILN_UNLOADED,
            "user-1",
            SMS_ONLY,
            NotificationPayload.builder().firingId("firing-1").build(),
            JobStatus.PROCESSING,
            FIXED_NOW,
            1,
            null,
            null,
            "worker-1",
            FIXED_NOW,
            FIXED_NOW,
            FIXED_NOW);
    when(contentBuilder.build(job)).thenReturn(CONTENT);
  }

  @Test
  void hardSmsFailureFallsBackToEmail() {
    when(smsSender.send(job, CONTENT))
        .thenReturn(SmsSendResult.hardFailed("400:21211:invalid number", "21211"));
    when(contactResolver.resolveEmail("user-1")).thenReturn(Optional.of("member@example.com"));

    final List<String> warnings = dispatcher.dispatch(job, SMS_ONLY);

    assertThat(warnings)
        .containsExactly("SMS_HARD_FAIL:400:21211:invalid number", "SMS_FALLBACK_EMAIL_SENT");
    verify(emailSender).send(job, CONTENT, "member@example.com");
    verify(metrics).recordSmsOutcome("hard_failed");
    final ArgumentCaptor<SmsAttempt> attempt = ArgumentCaptor.forClass(SmsAttempt.class);
    verify(attemptRecorder).recordSms(any(), attempt.capture());
    assertThat(attempt.getValue().fallbackStatus()).isEqualTo("sent");
  }

  @Test
  void fallbackWithoutEmailAddressOnlyWarns() {
    when(smsSender.send(job, CONTENT)).thenReturn(SmsSendResult.hardFailed("reason", "21610"));
    when(contactResolver.resolveEmail("user-1")).thenReturn(Optional.empty());

    final List<String> warnings = dispatcher.dispatch(job, SMS_ONLY);

    assertThat(warnings).containsExactly("SMS_HARD_FAIL:reason", "SMS_FALLBACK_EMAIL_MISSING");
    verifyNoInteractions(emailSender);
  }

  @Test
  void failingFallbackEmailIsRecordedAndRethrown() {
    when(smsSender.send(job, CONTENT)).thenReturn(SmsSendResult.hardFailed("reason", "21610"));
    when(contactResolver.resolveEmail("user-1")).thenReturn(Optional.of("member@example.com"));
    when(emailSender.send(any(), any(), anyString()))
        .thenThrow(new IllegalStateException("mail queue unavailable"));

    assertThatThrownBy(() -> dispatcher.dispatch(job, SMS_ONLY))
        .isInstanceOf(IllegalStateException.class);

    final ArgumentCaptor<SmsAttempt> attempt = ArgumentCaptor.forClass(SmsAttempt.class);
    verify(attemptRecorder).recordSms(any(), attempt.capture());
    assertThat(attempt.getValue().reason())
        .isEqualTo("SMS_FALLBACK_EMAIL_FAILED:mail queue unavailable");
  }

  @Test
  void skippedSmsDoesNotTriggerEmail() {
    when(smsSender.send(job, CONTENT)).thenReturn(SmsSendResult.skipped("PHONE_MISSING"));

    final List<String> warnings = dispatcher.dispatch(job, SMS_ONLY);

    assertThat(warnings).containsExactly("SMS_SKIPPED:PHONE_MISSING");
    verifyNoInteractions(emailSender, contactResolver);
  }

  @Test
  void everyEnabledChannelIsSent() {
    final DeliveryChannels all = new DeliveryChannels(true, true, true, false);
    when(contactResolver.resolveEmail("user-1")).thenReturn(Optional.of("member@example.com"));

    final List<String> warnings = dispatcher.dispatch(job, all);

    assertThat(warnings).isEmpty();
    verify(inAppSender).send(job, CONTENT);
    verify(emailSender).send(job, CONTENT, "member@example.com");
    verify(pushSender).send(job, CONTENT);
    verifyNoInteractions(smsSender);
  }
}
