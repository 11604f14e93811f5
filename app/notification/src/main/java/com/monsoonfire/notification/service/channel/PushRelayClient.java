/*
 * Where: Notification channel layer
 * What: Calls the APNs push relay once with every active token of a user
 * Why: The relay reports per-token outcomes so invalid tokens can be deactivated
 */
package com.monsoonfire.notification.service.channel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.monsoonfire.notification.config.PushRelayProperties;
import com.monsoonfire.notification.model.DeviceToken;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class PushRelayClient {

  static final String PROVIDER = "relay";
  private static final int MAX_ERROR_LENGTH = 1000;

  private final RestClient pushRelayRestClient;
  private final PushRelayProperties properties;
  private final ProviderPacer pacer;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public PushRelayClient(
      @Qualifier("pushRelayRestClient") RestClient pushRelayRestClient,
      PushRelayProperties properties,
      ProviderPacer pacer) {
    this.pushRelayRestClient = pushRelayRestClient;
    this.properties = properties;
    this.pacer = pacer;
  }

  public PushRelayResult send(
      List<DeviceToken> tokens, PushNotification notification, Map<String, String> context) {
    if (!properties.isConfigured()) {
      throw new ChannelDeliveryException(
          ChannelDeliveryException.Channel.PUSH,
          null,
          null,
          null,
          "APNS relay not configured: relay url and key are required");
    }
    final RelayRequest request =
        new RelayRequest(
            tokens.stream()
                .map(token -> new RelayToken(token.token(), token.tokenHash(), token.environment()))
                .toList(),
            notification,
            context);

    pacer.acquire(PROVIDER);
    final RelayResponse response;
    try {
      response =
          pushRelayRestClient
              .post()
              .uri(properties.relayUrl())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.relayKey())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(RelayResponse.class);
    } catch (RestClientResponseException ex) {
      final String message =
          "APNS relay failed: " + ex.getStatusCode().value() + " " + ex.getResponseBodyAsString();
      throw new ChannelDeliveryException(
          ChannelDeliveryException.Channel.PUSH,
          null,
          ex.getStatusCode().value(),
          null,
          message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message,
          ex);
    }
    return toResult(response);
  }

  private PushRelayResult toResult(RelayResponse response) {
    final List<TokenResult> results =
        response == null || response.results() == null
            ? List.of()
            : response.results().stream()
                .filter(
                    entry ->
                        entry != null && entry.tokenHash() != null && !entry.tokenHash().isBlank())
                .map(
                    entry ->
                        new TokenResult(
                            entry.tokenHash(),
                            Boolean.TRUE.equals(entry.ok()),
                            blankToNull(entry.providerCode()),
                            blankToNull(entry.message())))
                .toList();
    final int accepted =
        response != null && response.accepted() != null
            ? response.accepted()
            : (int) results.stream().filter(TokenResult::ok).count();
    final int rejected =
        response != null && response.rejected() != null
            ? response.rejected()
            : (int) results.stream().filter(result -> !result.ok()).count();
    return new PushRelayResult(PROVIDER, accepted, rejected, results);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  public record PushNotification(String title, String body, Map<String, String> data) {}

  public record PushRelayResult(
      String provider, int accepted, int rejected, List<TokenResult> results) {}

  public record TokenResult(String tokenHash, boolean ok, String providerCode, String message) {}

  record RelayRequest(
      List<RelayToken> tokens, PushNotification notification, Map<String, String> context) {}

  record RelayToken(String token, String tokenHash, String environment) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RelayResponse(Integer accepted, Integer rejected, List<RelayTokenResult> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RelayTokenResult(String tokenHash, Boolean ok, String providerCode, String message) {}
}
