/*
 * Where: Notification configuration binding
 * What: Polling, claim lease, retry and backoff settings of the job queue
 * Why: Operational knobs stay outside the code; unset values fall back to the documented defaults
 */
package com.monsoonfire.notification.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    Boolean enabled,
    Duration pollInterval,
    Integer batchSize,
    Integer maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    Double backoffExponentBase,
    Double backoffJitterMin,
    Double backoffJitterMax,
    Integer errorMessageMaxLength,
    Duration lease,
    Boolean immediateDispatch) {

  public NotificationDeliveryProperties {
    enabled = enabled == null || enabled;
    pollInterval = pollInterval == null ? Duration.ofMinutes(1) : pollInterval;
    batchSize = batchSize == null || batchSize <= 0 ? 50 : batchSize;
    maxAttempts = maxAttempts == null || maxAttempts <= 0 ? 5 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofSeconds(60) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofMinutes(30) : backoffMax;
    backoffExponentBase = backoffExponentBase == null ? 2.0 : backoffExponentBase;
    backoffJitterMin = backoffJitterMin == null ? 0.85 : backoffJitterMin;
    backoffJitterMax = backoffJitterMax == null ? 1.0 : backoffJitterMax;
    errorMessageMaxLength =
        errorMessageMaxLength == null || errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    lease = lease == null ? Duration.ofMinutes(5) : lease;
    immediateDispatch = immediateDispatch == null || immediateDispatch;
  }

  @AssertTrue(message = "notification.delivery backoff durations must be positive")
  public boolean isBackoffPositive() {
    return !backoffBase.isNegative()
        && !backoffBase.isZero()
        && !backoffMax.isNegative()
        && !backoffMax.isZero();
  }

  @AssertTrue(message = "notification.delivery jitter must satisfy 0 < min <= max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin > 0 && backoffJitterMin <= backoffJitterMax;
  }
}
