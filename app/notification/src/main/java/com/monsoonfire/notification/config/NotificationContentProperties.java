package com.monsoonfire.notification.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Time zone used when rendering timestamps into message text. */
@ConfigurationProperties(prefix = "notification.content")
public record NotificationContentProperties(ZoneId timeZone) {

  public NotificationContentProperties {
    timeZone = timeZone == null ? ZoneId.of("America/Phoenix") : timeZone;
  }
}
