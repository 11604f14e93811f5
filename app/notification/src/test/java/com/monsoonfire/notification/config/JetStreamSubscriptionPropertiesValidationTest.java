package com.monsoonfire.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JetStreamSubscriptionPropertiesValidationTest {

  private static final String SUBJECT = "reservation.events";
  private static final String STREAM = "reservation-events";
  private static final String DURABLE = "notification-reservation";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validSubscriptionPasses() {
    final JetStreamSubscriptionProperties properties =
        new JetStreamSubscriptionProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 10);

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void zeroAckWaitFails() {
    final JetStreamSubscriptionProperties properties =
        new JetStreamSubscriptionProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, Duration.ZERO, 10);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void zeroMaxDeliverFails() {
    final JetStreamSubscriptionProperties properties =
        new JetStreamSubscriptionProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 0);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void blankSubjectFails() {
    final JetStreamSubscriptionProperties properties =
        new JetStreamSubscriptionProperties(" ", STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 10);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void missingKilnSubscriptionFailsTheGroup() {
    final NotificationNatsProperties properties =
        new NotificationNatsProperties(
            new JetStreamSubscriptionProperties(
                SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 10),
            null);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
