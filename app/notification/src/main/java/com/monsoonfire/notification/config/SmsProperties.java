/*
 * Where: Notification configuration binding
 * What: SMS provider mode and Twilio credentials
 * Why: Environments without credentials run the channel disabled or mocked
 */
package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.sms")
public record SmsProperties(
    ProviderMode providerMode,
    MockMode mockMode,
    String twilioBaseUrl,
    String twilioAccountSid,
    String twilioAuthToken,
    String fromNumber,
    Integer maxBodyLength,
    Duration connectTimeout,
    Duration readTimeout) {

  public SmsProperties {
    providerMode = providerMode == null ? ProviderMode.DISABLED : providerMode;
    mockMode = mockMode == null ? MockMode.SUCCESS : mockMode;
    twilioBaseUrl =
        twilioBaseUrl == null || twilioBaseUrl.isBlank() ? "https://api.twilio.com" : twilioBaseUrl;
    maxBodyLength = maxBodyLength == null || maxBodyLength <= 0 ? 1200 : maxBodyLength;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  public boolean hasTwilioCredentials() {
    return notBlank(twilioAccountSid) && notBlank(twilioAuthToken) && notBlank(fromNumber);
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }

  public enum ProviderMode {
    DISABLED,
    MOCK,
    TWILIO
  }

  public enum MockMode {
    SUCCESS,
    AUTH,
    PROVIDER_4XX,
    PROVIDER_5XX,
    NETWORK
  }
}
