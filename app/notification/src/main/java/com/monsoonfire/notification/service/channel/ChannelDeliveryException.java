/*
 * Where: Notification channel layer
 * What: Failure of an outbound channel send (push relay, SMS provider)
 * Why: Carries the HTTP status, provider code and, when the sender already knows it, the
 *      failure class so the classifier never has to guess from text
 */
package com.monsoonfire.notification.service.channel;

import com.monsoonfire.notification.model.NotificationErrorClass;

public class ChannelDeliveryException extends RuntimeException {

  public enum Channel {
    PUSH,
    SMS,
    EMAIL,
    IN_APP
  }

  private final Channel channel;
  private final NotificationErrorClass errorClass;
  private final Integer httpStatus;
  private final String providerCode;

  public ChannelDeliveryException(
      Channel channel,
      NotificationErrorClass errorClass,
      Integer httpStatus,
      String providerCode,
      String message) {
    super(message);
    this.channel = channel;
    this.errorClass = errorClass;
    this.httpStatus = httpStatus;
    this.providerCode = providerCode;
  }

  public ChannelDeliveryException(
      Channel channel,
      NotificationErrorClass errorClass,
      Integer httpStatus,
      String providerCode,
      String message,
      Throwable cause) {
    super(message, cause);
    this.channel = channel;
    this.errorClass = errorClass;
    this.httpStatus = httpStatus;
    this.providerCode = providerCode;
  }

  public Channel channel() {
    return channel;
  }

  /** Null when the sender leaves classification to the HTTP status or message. */
  public NotificationErrorClass errorClass() {
    return errorClass;
  }

  public Integer httpStatus() {
    return httpStatus;
  }

  public String providerCode() {
    return providerCode;
  }
}
