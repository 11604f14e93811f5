/*
 * Where: Notification service layer
 * What: Schedules the bounded chain of delay follow-up jobs for one delay episode
 * Why: Each follow-up schedules the next only after it was sent and while the reservation is
 *      still delayed, so the chain ends by itself
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.notification.config.DelayFollowUpProperties;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import com.monsoonfire.notification.model.ReservationEventKind;
import com.monsoonfire.notification.model.ReservationRouting;
import com.monsoonfire.notification.model.ReservationSnapshot;
import com.monsoonfire.notification.repository.ReservationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DelayFollowUpChainer {

  private static final Logger logger = LoggerFactory.getLogger(DelayFollowUpChainer.class);
  static final String DELAYED_REASON =
      "Your reservation remains delayed while we work through active kiln constraints.";

  private final ReservationRepository reservationRepository;
  private final NotificationJobEnqueuer enqueuer;
  private final NotificationScheduleResolver scheduleResolver;
  private final DelayFollowUpProperties properties;
  private final Clock clock;

  /** First follow-up of an episode, ordinal 1, after the initial delay. */
  public boolean startChain(
      ReservationRouting routing,
      ReservationSnapshot before,
      ReservationSnapshot after,
      String delayEpisodeId) {
    return enqueueFollowUp(
        after.ownerUid(),
        routing,
        before,
        after,
        delayEpisodeId,
        1,
        properties.initialDelay(),
        null);
  }

  /**
   * Called after a follow-up job was delivered. Returns true when the next ordinal was enqueued.
   */
  public boolean scheduleNext(NotificationJob job, ReservationRouting routing) {
    final NotificationPayload payload = job.payload();
    if (job.type() != NotificationJobType.RESERVATION_DELAY_FOLLOW_UP
        || payload == null
        || payload.eventKind() != ReservationEventKind.DELAY_FOLLOW_UP) {
      return false;
    }
    if (routing == null || routing.skipReason().isPresent()) {
      return false;
    }
    final String reservationId =
        payload.reservationId() == null ? "" : payload.reservationId().trim();
    if (reservationId.isEmpty()) {
      return false;
    }
    final Optional<ReservationSnapshot> found = reservationRepository.findById(reservationId);
    if (found.isEmpty() || !JobEligibilityService.isStillDelayed(found.get())) {
      return false;
    }
    final ReservationSnapshot reservation = found.get();
    final int current =
        payload.delayFollowUpOrdinal() == null ? 1 : Math.max(1, payload.delayFollowUpOrdinal());
    final int next = current + 1;
    if (next > properties.maxOrdinal()) {
      logger.info(
          "delay follow-up chain reached its cap reservationId={} ordinal={}",
          reservationId,
          current);
      return false;
    }
    final String episodeId =
        payload.delayEpisodeId() != null && !payload.delayEpisodeId().isBlank()
            ? payload.delayEpisodeId().trim()
            : episodeIdFor(reservation, Instant.now(clock));
    return enqueueFollowUp(
        job.uid(),
        routing,
        null,
        reservation,
        episodeId,
        next,
        properties.repeatInterval(),
        payload);
  }

  /** Episode id: the estimate's update time, else the reservation's, else now. */
  public static String episodeIdFor(ReservationSnapshot reservation, Instant now) {
    if (reservation.estimatedWindow().updatedAt() != null) {
      return reservation.estimatedWindow().updatedAt().toString();
    }
    return (reservation.updatedAt() != null ? reservation.updatedAt() : now).toString();
  }

  private boolean enqueueFollowUp(
      String uid,
      ReservationRouting routing,
      ReservationSnapshot before,
      ReservationSnapshot reservation,
      String episodeId,
      int ordinal,
      Duration delay,
      NotificationPayload previous) {
    final Instant base = Instant.now(clock).plus(delay);
    final Instant runAfter = scheduleResolver.resolveRunAfter(base, routing.preferences());
    final NotificationPayload.NotificationPayloadBuilder builder =
        ReservationPayloads.base(before, reservation)
            .dedupeKey(
                "RESERVATION_DELAY_FOLLOW_UP:"
                    + reservation.reservationId()
                    + ":"
                    + episodeId
                    + ":"
                    + ordinal)
            .eventKind(ReservationEventKind.DELAY_FOLLOW_UP)
            .reason(reservation.reasonOr(DELAYED_REASON))
            .suggestedNextUpdateAtIso(ReservationPayloads.iso(runAfter))
            .delayEpisodeId(episodeId)
            .delayFollowUpOrdinal(ordinal);
    if (previous != null) {
      builder
          .previousReservationStatus(previous.reservationStatus())
          .previousReservationLoadStatus(previous.reservationLoadStatus())
          .previousWindowStartIso(previous.currentWindowStartIso())
          .previousWindowEndIso(previous.currentWindowEndIso());
    }
    return enqueuer.enqueueReservationJob(
        NotificationJobType.RESERVATION_DELAY_FOLLOW_UP,
        uid,
        routing,
        builder.build(),
        runAfter);
  }
}
