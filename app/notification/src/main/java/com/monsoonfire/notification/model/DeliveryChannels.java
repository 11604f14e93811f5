package com.monsoonfire.notification.model;

public record DeliveryChannels(boolean inApp, boolean email, boolean push, boolean sms) {

  public static DeliveryChannels none() {
    return new DeliveryChannels(false, false, false, false);
  }

  public static DeliveryChannels inAppOnly() {
    return new DeliveryChannels(true, false, false, false);
  }

  public boolean hasAny() {
    return inApp || email || push || sms;
  }
}
