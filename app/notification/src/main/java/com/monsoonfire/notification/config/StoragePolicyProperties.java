/*
 * Where: Notification configuration binding
 * What: Storage-policy sweep cadence and escalation thresholds
 * Why: Reminder ordinals and the hold/stored ceilings are measured from the pickup anchor
 */
package com.monsoonfire.notification.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.storage-policy")
@Validated
public record StoragePolicyProperties(
    Boolean enabled,
    Duration sweepInterval,
    Integer batchLimit,
    List<Duration> reminderThresholds,
    Duration holdPendingAfter,
    Duration storedByPolicyAfter,
    Integer historyMax) {

  public StoragePolicyProperties {
    enabled = enabled == null || enabled;
    sweepInterval = sweepInterval == null ? Duration.ofHours(1) : sweepInterval;
    batchLimit = batchLimit == null || batchLimit <= 0 ? 200 : batchLimit;
    reminderThresholds =
        reminderThresholds == null || reminderThresholds.isEmpty()
            ? List.of(Duration.ofHours(72), Duration.ofHours(120), Duration.ofHours(168))
            : List.copyOf(reminderThresholds);
    holdPendingAfter = holdPendingAfter == null ? Duration.ofHours(120) : holdPendingAfter;
    storedByPolicyAfter =
        storedByPolicyAfter == null ? Duration.ofHours(192) : storedByPolicyAfter;
    historyMax = historyMax == null || historyMax <= 0 ? 60 : historyMax;
  }

  @AssertTrue(
      message = "notification.storage-policy.reminder-thresholds must be positive and ascending")
  public boolean isReminderScheduleAscending() {
    Duration previous = Duration.ZERO;
    for (Duration threshold : reminderThresholds) {
      if (threshold == null || threshold.compareTo(previous) <= 0) {
        return false;
      }
      previous = threshold;
    }
    return true;
  }

  @AssertTrue(
      message =
          "notification.storage-policy.stored-by-policy-after must exceed hold-pending-after")
  public boolean isCeilingOrdered() {
    return !holdPendingAfter.isNegative()
        && !holdPendingAfter.isZero()
        && storedByPolicyAfter.compareTo(holdPendingAfter) > 0;
  }

  /** Threshold for a 1-based reminder ordinal. */
  public Duration thresholdFor(int ordinal) {
    return reminderThresholds.get(ordinal - 1);
  }
}
