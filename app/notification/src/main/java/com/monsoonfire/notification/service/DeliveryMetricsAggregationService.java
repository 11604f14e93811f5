/*
 * Where: Notification service layer
 * What: Rolls recent delivery attempts up into status, reason and provider counts
 * Why: Operators read one snapshot row instead of scanning the attempt table
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.config.DeliveryMetricsProperties;
import com.monsoonfire.notification.model.DeliveryMetricsSummary;
import com.monsoonfire.notification.repository.DeliveryAttemptRepository;
import com.monsoonfire.notification.repository.DeliveryAttemptRepository.AttemptOutcomeRow;
import com.monsoonfire.notification.repository.DeliveryMetricSnapshotRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryMetricsAggregationService {

  private static final Logger logger =
      LoggerFactory.getLogger(DeliveryMetricsAggregationService.class);
  static final String SNAPSHOT_ID = "delivery_24h";

  private final DeliveryAttemptRepository attemptRepository;
  private final DeliveryMetricSnapshotRepository snapshotRepository;
  private final DeliveryMetricsProperties properties;
  private final Clock clock;

  /** {@code triggerMode} is "scheduled" or "manual"; {@code triggeredBy} is the admin uid. */
  public DeliveryMetricsSummary aggregate(String triggerMode, String triggeredBy) {
    final Instant now = Instant.now(clock);
    final Instant cutoff = now.minus(Duration.ofHours(properties.windowHours()));
    final List<AttemptOutcomeRow> rows =
        attemptRepository.findOutcomesSince(cutoff, properties.maxAttempts());
    final DeliveryMetricsSummary summary =
        new DeliveryMetricsSummary(
            SNAPSHOT_ID,
            properties.windowHours(),
            rows.size(),
            count(rows, AttemptOutcomeRow::status),
            count(rows, AttemptOutcomeRow::reason),
            count(rows, AttemptOutcomeRow::provider),
            triggerMode,
            triggeredBy,
            now);
    snapshotRepository.save(summary);
    logger.info(
        "delivery metrics aggregated attempts={} windowHours={} trigger={}",
        summary.totalAttempts(),
        summary.windowHours(),
        triggerMode);
    return summary;
  }

  private static Map<String, Integer> count(
      List<AttemptOutcomeRow> rows, Function<AttemptOutcomeRow, String> key) {
    final Map<String, Integer> counts = new TreeMap<>();
    for (AttemptOutcomeRow row : rows) {
      final String value = key.apply(row);
      counts.merge(value == null || value.isBlank() ? "unknown" : value, 1, Integer::sum);
    }
    return counts;
  }
}
