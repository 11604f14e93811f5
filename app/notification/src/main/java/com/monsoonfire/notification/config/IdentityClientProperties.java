/*
 * Where: Notification configuration binding
 * What: Account directory endpoint and internal credentials
 * Why: Contact lookups go through the account service's internal API
 */
package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.identity")
public record IdentityClientProperties(
    String baseUrl,
    String contactPath,
    String internalApiHeaderName,
    String internalApiToken,
    Duration connectTimeout,
    Duration readTimeout) {

  public IdentityClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://account:80" : baseUrl;
    contactPath =
        contactPath == null || contactPath.isBlank()
            ? "/internal/users/{userId}/contact"
            : contactPath;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(3) : readTimeout;
  }
}
