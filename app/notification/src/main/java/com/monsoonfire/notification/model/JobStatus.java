/*
 * Where: Notification model
 * What: Lifecycle states of a notification job
 * Why: queued -> processing -> {done, skipped, failed}; processing -> queued on a retryable failure
 */
package com.monsoonfire.notification.model;

public enum JobStatus {
  QUEUED,
  PROCESSING,
  DONE,
  FAILED,
  SKIPPED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED || this == SKIPPED;
  }
}
