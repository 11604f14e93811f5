package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.push")
public record PushRelayProperties(
    String relayUrl,
    String relayKey,
    Integer maxTokens,
    Duration connectTimeout,
    Duration readTimeout) {

  public PushRelayProperties {
    maxTokens = maxTokens == null || maxTokens <= 0 ? 20 : maxTokens;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  public boolean isConfigured() {
    return relayUrl != null && !relayUrl.isBlank() && relayKey != null && !relayKey.isBlank();
  }
}
