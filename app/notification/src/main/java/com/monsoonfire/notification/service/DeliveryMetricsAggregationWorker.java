package com.monsoonfire.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.metrics-aggregation.enabled", havingValue = "true")
public class DeliveryMetricsAggregationWorker {

  private final DeliveryMetricsAggregationService aggregationService;

  @Scheduled(fixedDelayString = "${notification.metrics-aggregation.interval}")
  public void run() {
    aggregationService.aggregate("scheduled", null);
  }
}
