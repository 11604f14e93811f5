/*
 * Where: Notification configuration binding
 * What: Retention cleanup and stale device token settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.retention")
public record NotificationRetentionProperties(
    boolean enabled,
    int retentionDays,
    Duration cleanupInterval,
    Duration staleDeviceTokenAge,
    Integer staleDeviceTokenLimit) {

  public NotificationRetentionProperties {
    retentionDays = retentionDays <= 0 ? 30 : retentionDays;
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(24) : cleanupInterval;
    staleDeviceTokenAge = staleDeviceTokenAge == null ? Duration.ofDays(90) : staleDeviceTokenAge;
    staleDeviceTokenLimit =
        staleDeviceTokenLimit == null || staleDeviceTokenLimit <= 0 ? 250 : staleDeviceTokenLimit;
  }
}
