/*
 * Where: Notification service layer
 * What: Job outcome, dead letter, SMS, dispatch latency, backlog and storage transition metrics
 * Why: Queue health and storage-policy escalation are observed from Prometheus
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.StorageStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  private static final String METRIC_JOB_OUTCOME = "notification.job.outcome";
  private static final String METRIC_DEAD_LETTER_TOTAL = "notification.dead_letter.total";
  private static final String METRIC_SMS_OUTCOME = "notification.sms.outcome";
  private static final String METRIC_JOB_DISPATCH = "notification.job.dispatch";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  private static final String METRIC_STORAGE_TRANSITION = "notification.storage.transition";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter deadLetterCounter;
  private final Timer dispatchTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Queued jobs whose run_after has passed")
        .register(meterRegistry);
    this.deadLetterCounter =
        Counter.builder(METRIC_DEAD_LETTER_TOTAL)
            .description("Jobs moved to the dead letter table")
            .register(meterRegistry);
    this.dispatchTimer =
        Timer.builder(METRIC_JOB_DISPATCH)
            .description("Time spent dispatching one job attempt across its channels")
            .register(meterRegistry);
  }

  /** result is one of done, skipped, retry, failed. */
  public void recordJobOutcome(String result) {
    counter(METRIC_JOB_OUTCOME, "result", result, "Notification job attempt outcomes").increment();
  }

  public void recordSmsOutcome(String outcome) {
    counter(METRIC_SMS_OUTCOME, "outcome", outcome, "SMS send outcomes").increment();
  }

  public void recordStorageTransition(StorageStatus to) {
    counter(
            METRIC_STORAGE_TRANSITION,
            "to",
            to.wireName(),
            "Reservation storage status transitions")
        .increment();
  }

  public void recordDeadLetter() {
    deadLetterCounter.increment();
  }

  public void recordDispatchDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    dispatchTimer.record(duration);
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String tagKey, String tagValue, String description) {
    return counters.computeIfAbsent(
        name + "|" + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
