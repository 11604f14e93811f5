/*
 * Where: Notification configuration
 * What: One RestClient per outbound collaborator with connect/read timeouts
 * Why: Every provider call must be bounded so a hung provider surfaces as a network failure
 */
package com.monsoonfire.notification.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ProviderClientConfig {

  @Bean
  RestClient accountRestClient(RestClient.Builder builder, IdentityClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient pushRelayRestClient(RestClient.Builder builder, PushRelayProperties properties) {
    // the relay URL is used as an absolute URI per call, so no base URL here
    return builder
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient twilioRestClient(RestClient.Builder builder, SmsProperties properties) {
    return builder
        .baseUrl(properties.twilioBaseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  private SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
