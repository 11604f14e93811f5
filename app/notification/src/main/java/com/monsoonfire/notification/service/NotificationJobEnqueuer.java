/*
 * Where: Notification service layer
 * What: Creates notification jobs idempotently by dedupe key
 * Why: Event redelivery and repeated sweeps enqueue the same key again; only the first write counts
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.config.NotificationDeliveryProperties;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.JobStatus;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobSpec;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.model.SkipReason;
import com.monsoonfire.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationJobEnqueuer {

  private static final Logger logger = LoggerFactory.getLogger(NotificationJobEnqueuer.class);

  private final NotificationJobRepository jobRepository;
  private final ImmediateJobDispatcher immediateDispatcher;
  private final NotificationScheduleResolver scheduleResolver;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;

  /**
   * Enqueues a reservation job on the recipient's routing. Disabled routing still creates the job,
   * directly in SKIPPED. A null {@code runAfter} is resolved from now against the preferences.
   */
  public boolean enqueueReservationJob(
      NotificationJobType type,
      String uid,
      ReservationRouting routing,
      NotificationPayload payload,
      Instant runAfter) {
    final Optional<SkipReason> skipReason = routing.skipReason();
    if (skipReason.isPresent()) {
      return enqueue(
          NotificationJobSpec.skipped(type, uid, payload.dedupeKey(), payload, skipReason.get()));
    }
    final Instant resolvedRunAfter =
        runAfter != null
            ? runAfter
            : scheduleResolver.resolveRunAfter(Instant.now(clock), routing.preferences());
    return enqueue(
        NotificationJobSpec.queued(
            type, uid, payload.dedupeKey(), routing.channels(), payload, resolvedRunAfter));
  }

  /** Returns true when a new job was created; false when the dedupe key already had one. */
  public boolean enqueue(NotificationJobSpec spec) {
    if (spec.type() == null) {
      throw new IllegalArgumentException("job type is required");
    }
    if (spec.uid() == null || spec.uid().isBlank()) {
      throw new IllegalArgumentException("uid is required");
    }
    if (spec.dedupeKey() == null || spec.dedupeKey().isBlank()) {
      throw new IllegalArgumentException("dedupeKey is required");
    }
    final Instant now = Instant.now(clock);
    final boolean skipped = spec.skipReason() != null;
    final NotificationPayload payload =
        (spec.payload() == null ? NotificationPayload.builder().build() : spec.payload())
            .toBuilder()
            .dedupeKey(spec.dedupeKey())
            .build();
    final NotificationJob job =
        new NotificationJob(
            DedupeHashes.sha256Hex(spec.dedupeKey()),
            spec.dedupeKey(),
            spec.type(),
            spec.uid(),
            spec.channels() == null ? DeliveryChannels.none() : spec.channels(),
            payload,
            skipped ? JobStatus.SKIPPED : JobStatus.QUEUED,
            skipped ? null : spec.runAfter(),
            0,
            skipped ? spec.skipReason().name() : null,
            null,
            null,
            null,
            now,
            now);

    final boolean created = jobRepository.insertIfAbsent(job);
    if (!created) {
      logger.debug(
          "notification job already exists jobId={} dedupeKey={}", job.jobId(), job.dedupeKey());
      return false;
    }
    if (skipped) {
      logger.info(
          "notification job created as skipped jobId={} type={} reason={}",
          job.jobId(),
          job.type(),
          spec.skipReason());
      return true;
    }
    logger.info(
        "notification job queued jobId={} type={} runAfter={}",
        job.jobId(),
        job.type(),
        job.runAfter());
    if (properties.immediateDispatch()
        && (job.runAfter() == null || !job.runAfter().isAfter(now))) {
      immediateDispatcher.dispatchAfterCommit(job.jobId());
    }
    return true;
  }
}
