/*
 * Where: Notification service layer
 * What: One retention pass over the queue, event markers, delivery attempts and device tokens
 * Why: Queued or processing jobs past the window are reported and kept; dead letters are never
 *      pruned here
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.config.NotificationRetentionProperties;
import com.monsoonfire.notification.repository.DeliveryAttemptRepository;
import com.monsoonfire.notification.repository.NotificationJobRepository;
import com.monsoonfire.notification.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationJobRepository jobRepository;
  private final ProcessedEventRepository processedEventRepository;
  private final DeliveryAttemptRepository deliveryAttemptRepository;
  private final DeviceTokenService deviceTokenService;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public RetentionResult cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveJobs = jobRepository.countStaleActive(threshold);
    if (staleActiveJobs > 0) {
      logger.error(
          "notification retention found stale queued or processing jobs count={} threshold={}",
          staleActiveJobs,
          threshold);
    }
    final RetentionResult result =
        new RetentionResult(
            staleActiveJobs,
            jobRepository.deleteTerminalOlderThan(threshold),
            processedEventRepository.deleteOlderThan(threshold),
            deliveryAttemptRepository.deleteOlderThan(threshold),
            deactivateStaleTokens());
    logger.info(
        "notification retention cleanup deleted jobs={} processedEvents={} deliveryAttempts={}"
            + " deactivatedTokens={} threshold={}",
        result.deletedJobs(),
        result.deletedProcessedEvents(),
        result.deletedDeliveryAttempts(),
        result.deactivatedDeviceTokens(),
        threshold);
    return result;
  }

  // token hygiene is independent of row pruning; a failure here keeps the deletions above
  private int deactivateStaleTokens() {
    try {
      return deviceTokenService.deactivateStaleTokens();
    } catch (RuntimeException ex) {
      logger.error("stale device token deactivation failed", ex);
      return 0;
    }
  }

  public record RetentionResult(
      int staleActiveJobs,
      int deletedJobs,
      int deletedProcessedEvents,
      int deletedDeliveryAttempts,
      int deactivatedDeviceTokens) {}
}
