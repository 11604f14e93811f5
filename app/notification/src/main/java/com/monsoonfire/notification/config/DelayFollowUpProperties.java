package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.delay-follow-up")
public record DelayFollowUpProperties(
    Duration initialDelay, Duration repeatInterval, Integer maxOrdinal) {

  public DelayFollowUpProperties {
    initialDelay = initialDelay == null ? Duration.ofHours(12) : initialDelay;
    repeatInterval = repeatInterval == null ? Duration.ofHours(24) : repeatInterval;
    maxOrdinal = maxOrdinal == null || maxOrdinal <= 0 ? 14 : maxOrdinal;
  }
}
