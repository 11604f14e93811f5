/*
 * Where: Notification operator API
 * What: Dead-letter listing, job lookup and run-now triggers for the background workers
 * Why: Operators inspect and nudge the pipeline without waiting for the next scheduled tick
 */
package com.monsoonfire.notification.api;

import com.monsoonfire.notification.model.DeadLetterRecord;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.DeliveryMetricsSummary;
import com.monsoonfire.notification.model.DrillMode;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.repository.DeadLetterRepository;
import com.monsoonfire.notification.repository.NotificationJobRepository;
import com.monsoonfire.notification.service.DeliveryMetricsAggregationService;
import com.monsoonfire.notification.service.NotificationDrillService;
import com.monsoonfire.notification.service.NotificationJobProcessor;
import com.monsoonfire.notification.service.storage.ReservationStoragePolicyService;
import com.monsoonfire.notification.service.storage.ReservationStoragePolicyService.SweepSummary;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

  private static final Logger logger = LoggerFactory.getLogger(NotificationAdminController.class);
  private static final int MAX_DEAD_LETTER_LIMIT = 200;

  private final DeadLetterRepository deadLetterRepository;
  private final NotificationJobRepository jobRepository;
  private final NotificationJobProcessor jobProcessor;
  private final ReservationStoragePolicyService storagePolicyService;
  private final NotificationDrillService drillService;
  private final DeliveryMetricsAggregationService metricsAggregationService;

  @GetMapping("/dead-letters")
  public List<DeadLetterRecord> deadLetters(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit <= 0 || limit > MAX_DEAD_LETTER_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_DEAD_LETTER_LIMIT);
    }
    return deadLetterRepository.findRecent(limit);
  }

  @GetMapping("/jobs/{jobId}")
  public NotificationJob job(@PathVariable("jobId") String jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new NoSuchElementException("job not found: " + jobId));
  }

  @PostMapping("/jobs/process-due")
  public ProcessDueResponse processDue(Authentication authentication) {
    logger.info("manual due-job processing requested by={}", authentication.getName());
    return new ProcessDueResponse(jobProcessor.processDueJobs());
  }

  @PostMapping("/storage-policy/sweep")
  public SweepSummary sweepStoragePolicy(Authentication authentication) {
    logger.info("manual storage policy sweep requested by={}", authentication.getName());
    return storagePolicyService.runSweep();
  }

  @PostMapping("/drills")
  public NotificationDrillService.DrillTicket drill(@Valid @RequestBody DrillRequest request) {
    return drillService.runDrill(
        request.uid(),
        request.mode(),
        request.channels(),
        Boolean.TRUE.equals(request.forceRunNow()));
  }

  @PostMapping("/delivery-metrics/aggregate")
  public DeliveryMetricsSummary aggregateDeliveryMetrics(Authentication authentication) {
    return metricsAggregationService.aggregate("manual", authentication.getName());
  }

  public record ProcessDueResponse(int processed) {}

  public record DrillRequest(
      @NotBlank String uid,
      @NotNull DrillMode mode,
      DeliveryChannels channels,
      Boolean forceRunNow) {}
}
