package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.metrics-aggregation")
public record DeliveryMetricsProperties(
    boolean enabled, Duration interval, Integer windowHours, Integer maxAttempts) {

  public DeliveryMetricsProperties {
    interval = interval == null ? Duration.ofMinutes(30) : interval;
    windowHours = windowHours == null || windowHours <= 0 ? 24 : windowHours;
    maxAttempts = maxAttempts == null || maxAttempts <= 0 ? 4000 : maxAttempts;
  }
}
