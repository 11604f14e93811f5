/*
 * Where: Notification channel layer
 * What: Sends one SMS through the Twilio Messages API
 * Why: Non-2xx responses are returned with their provider code so the sender can tell hard
 *      failures from retryable ones; transport failures propagate as ResourceAccessException
 */
package com.monsoonfire.notification.service.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.notification.config.SmsProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

@Component
public class TwilioSmsClient {

  static final String PROVIDER = "twilio";
  private static final String MESSAGES_PATH = "/2010-04-01/Accounts/{accountSid}/Messages.json";
  private static final int MAX_RAW_MESSAGE = 240;

  private final RestClient twilioRestClient;
  private final SmsProperties properties;
  private final ProviderPacer pacer;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and ObjectMapper are shared Spring-managed components")
  public TwilioSmsClient(
      @Qualifier("twilioRestClient") RestClient twilioRestClient,
      SmsProperties properties,
      ProviderPacer pacer,
      ObjectMapper objectMapper) {
    this.twilioRestClient = twilioRestClient;
    this.properties = properties;
    this.pacer = pacer;
    this.objectMapper = objectMapper;
  }

  public TwilioResponse send(String toE164, String body) {
    if (!properties.hasTwilioCredentials()) {
      throw new ChannelDeliveryException(
          ChannelDeliveryException.Channel.SMS,
          null,
          null,
          null,
          "SMS_CONFIG: Twilio credentials or sender number not configured");
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("To", toE164);
    form.add("From", properties.fromNumber());
    form.add("Body", body);

    pacer.acquire(PROVIDER);
    return twilioRestClient
        .post()
        .uri(MESSAGES_PATH, properties.twilioAccountSid())
        .headers(
            headers ->
                headers.setBasicAuth(
                    properties.twilioAccountSid(),
                    properties.twilioAuthToken(),
                    StandardCharsets.UTF_8))
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .accept(MediaType.APPLICATION_JSON)
        .body(form)
        .exchange(
            (request, response) ->
                parse(response.getStatusCode().value(), readBody(response.getBody())));
  }

  TwilioResponse parse(int status, String rawBody) {
    final boolean ok = status >= 200 && status < 300;
    JsonNode json = null;
    if (!rawBody.isBlank()) {
      try {
        json = objectMapper.readTree(rawBody);
      } catch (JsonProcessingException ex) {
        // non-JSON error pages keep their raw text as the message
        json = null;
      }
    }
    final String message = text(json, "message");
    return new TwilioResponse(
        ok,
        status,
        text(json, "sid"),
        text(json, "status"),
        text(json, "code"),
        message != null
            ? message
            : rawBody.isBlank()
                ? null
                : rawBody.substring(0, Math.min(MAX_RAW_MESSAGE, rawBody.length())));
  }

  private static String readBody(InputStream body) throws IOException {
    if (body == null) {
      return "";
    }
    return new String(body.readAllBytes(), StandardCharsets.UTF_8);
  }

  private static String text(JsonNode json, String field) {
    if (json == null || !json.isObject()) {
      return null;
    }
    final JsonNode value = json.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    final String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }

  /** {@code providerCode} is Twilio's numeric error code as text, e.g. 21211. */
  public record TwilioResponse(
      boolean ok,
      int status,
      String sid,
      String twilioStatus,
      String providerCode,
      String providerMessage) {}
}
