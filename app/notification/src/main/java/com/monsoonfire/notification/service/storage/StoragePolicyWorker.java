package com.monsoonfire.notification.service.storage;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.storage-policy.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StoragePolicyWorker {

  private final ReservationStoragePolicyService storagePolicyService;

  @Scheduled(
      fixedDelayString = "${notification.storage-policy.sweep-interval}",
      initialDelayString = "${notification.storage-policy.sweep-interval}")
  public void run() {
    storagePolicyService.runSweep();
  }
}
