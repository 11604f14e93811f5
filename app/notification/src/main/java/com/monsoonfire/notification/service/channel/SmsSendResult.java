package com.monsoonfire.notification.service.channel;

/**
 * Outcome of an SMS send that did not throw. Retryable failures are thrown instead; only hard
 * failures come back here so the dispatcher can fall back to email.
 */
public record SmsSendResult(Outcome outcome, String provider, String reason, String providerCode) {

  public enum Outcome {
    SENT,
    SKIPPED,
    HARD_FAILED
  }

  public static SmsSendResult sent(String provider) {
    return new SmsSendResult(Outcome.SENT, provider, null, null);
  }

  public static SmsSendResult skipped(String reason) {
    return new SmsSendResult(Outcome.SKIPPED, null, reason, null);
  }

  public static SmsSendResult hardFailed(String reason, String providerCode) {
    return new SmsSendResult(Outcome.HARD_FAILED, null, reason, providerCode);
  }
}
