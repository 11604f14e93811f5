/*
 * Where: Notification service layer
 * What: Maps any delivery failure to auth / network / provider_4xx / provider_5xx / unknown
 * Why: Retry and dead-letter decisions are made on the class alone
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.service.channel.ChannelDeliveryException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class NotificationErrorClassifier {

  private static final Pattern AUTH_TEXT =
      Pattern.compile("\\b(401|403)\\b|unauth|forbidden");
  private static final Pattern NETWORK_TEXT =
      Pattern.compile(
          "\\b(408|429)\\b|timeout|timed out|network|econn|enotfound|socket"
              + "|rate limit|too many requests");
  private static final Pattern STATUS_TEXT = Pattern.compile("\\b([45]\\d\\d)\\b");

  public NotificationErrorClass classify(Throwable error) {
    if (error == null) {
      return NotificationErrorClass.UNKNOWN;
    }
    if (error instanceof ChannelDeliveryException channelError) {
      if (channelError.errorClass() != null) {
        return channelError.errorClass();
      }
      if (channelError.httpStatus() != null) {
        return classifyHttpStatus(channelError.httpStatus());
      }
    }
    if (error instanceof RestClientResponseException responseError) {
      return classifyHttpStatus(responseError.getStatusCode().value());
    }
    if (error instanceof ResourceAccessException || hasNetworkCause(error)) {
      return NotificationErrorClass.NETWORK;
    }
    if (error instanceof IdentityLookupException identityError
        && identityError.reason() == IdentityLookupException.Reason.TIMEOUT) {
      return NotificationErrorClass.NETWORK;
    }
    return classifyText(error.getMessage());
  }

  public NotificationErrorClass classifyHttpStatus(int status) {
    if (status == 401 || status == 403) {
      return NotificationErrorClass.AUTH;
    }
    if (status == 408 || status == 429) {
      return NotificationErrorClass.NETWORK;
    }
    if (status >= 500) {
      return NotificationErrorClass.PROVIDER_5XX;
    }
    if (status >= 400) {
      return NotificationErrorClass.PROVIDER_4XX;
    }
    return NotificationErrorClass.UNKNOWN;
  }

  NotificationErrorClass classifyText(String message) {
    if (message == null || message.isBlank()) {
      return NotificationErrorClass.UNKNOWN;
    }
    final String text = message.toLowerCase(Locale.ROOT);
    if (AUTH_TEXT.matcher(text).find()) {
      return NotificationErrorClass.AUTH;
    }
    if (NETWORK_TEXT.matcher(text).find()) {
      return NotificationErrorClass.NETWORK;
    }
    final Matcher status = STATUS_TEXT.matcher(text);
    if (status.find()) {
      return classifyHttpStatus(Integer.parseInt(status.group(1)));
    }
    return NotificationErrorClass.UNKNOWN;
  }

  private boolean hasNetworkCause(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof ConnectException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
