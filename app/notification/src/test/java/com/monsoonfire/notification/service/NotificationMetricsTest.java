package com.monsoonfire.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.monsoonfire.notification.model.StorageStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  private SimpleMeterRegistry registry;
  private NotificationMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new NotificationMetrics(registry);
  }

  @Test
  void outcomesAreCountedPerTag() {
    metrics.recordJobOutcome("done");
    metrics.recordJobOutcome("done");
    metrics.recordJobOutcome("retry");
    metrics.recordSmsOutcome("sent");
    metrics.recordStorageTransition(StorageStatus.HOLD_PENDING);
    metrics.recordDeadLetter();

    assertThat(registry.get("notification.job.outcome").tag("result", "done").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("notification.job.outcome").tag("result", "retry").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("notification.sms.outcome").tag("outcome", "sent").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry
                .get("notification.storage.transition")
                .tag("to", "hold_pending")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(registry.get("notification.dead_letter.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void backlogGaugeNeverGoesNegative() {
    metrics.updateBacklogCurrent(7);
    assertThat(registry.get("notification.backlog.current").gauge().value()).isEqualTo(7.0);

    metrics.updateBacklogCurrent(-3);
    assertThat(registry.get("notification.backlog.current").gauge().value()).isZero();
  }

  @Test
  void negativeDispatchDurationIsIgnored() {
    metrics.recordDispatchDuration(Duration.ofMillis(40));
    metrics.recordDispatchDuration(Duration.ofMillis(-1));
    metrics.recordDispatchDuration(null);

    assertThat(registry.get("notification.job.dispatch").timer().count()).isEqualTo(1L);
  }
}
