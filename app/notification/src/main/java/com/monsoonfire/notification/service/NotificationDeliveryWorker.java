/*
 * Where: Notification delivery worker
 * What: Triggers due-job processing on a schedule
 * Why: Jobs whose immediate dispatch was skipped or that wait for a retry are picked up here
 */
package com.monsoonfire.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker {

  private final NotificationJobProcessor jobProcessor;

  @Scheduled(fixedDelayString = "${notification.delivery.poll-interval}")
  public void run() {
    jobProcessor.processDueJobs();
  }
}
