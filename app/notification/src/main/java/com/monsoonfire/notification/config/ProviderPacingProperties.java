package com.monsoonfire.notification.config;

import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Minimum spacing between outbound calls, per provider name. */
@ConfigurationProperties(prefix = "notification.pacing")
public record ProviderPacingProperties(
    Duration defaultMinInterval, Map<String, Duration> minInterval) {

  public ProviderPacingProperties {
    defaultMinInterval = defaultMinInterval == null ? Duration.ofMillis(250) : defaultMinInterval;
    minInterval = minInterval == null ? Map.of() : Map.copyOf(minInterval);
  }

  public Duration intervalFor(String provider) {
    return minInterval.getOrDefault(provider, defaultMinInterval);
  }
}
