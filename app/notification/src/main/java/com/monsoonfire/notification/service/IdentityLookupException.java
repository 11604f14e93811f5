/*
 * Where: Notification service layer
 * What: Failure of an account directory lookup
 * Why: Callers decide per use whether a missing contact degrades the send or fails it
 */
package com.monsoonfire.notification.service;

public class IdentityLookupException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public IdentityLookupException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IdentityLookupException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
