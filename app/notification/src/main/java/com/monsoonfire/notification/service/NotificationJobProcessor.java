/*
 * Where: Notification service layer
 * What: Claims due jobs and runs one attempt each: gate, dispatch, then done, retry or dead letter
 * Why: The claim is a single guarded UPDATE, so no two workers dispatch the same job at once and
 *      channel IO never runs inside a long transaction
 */
package com.monsoonfire.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.monsoonfire.common.TraceIds;
import com.monsoonfire.notification.config.NotificationDeliveryProperties;
import com.monsoonfire.notification.model.DeadLetterRecord;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.repository.DeadLetterRepository;
import com.monsoonfire.notification.repository.NotificationJobRepository;
import com.monsoonfire.notification.service.JobEligibilityService.Eligibility;
import com.monsoonfire.notification.service.channel.ChannelDispatcher;
import com.monsoonfire.notification.service.storage.ReminderFailureRecorder;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationJobProcessor {

  private static final Logger logger = LoggerFactory.getLogger(NotificationJobProcessor.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_JOB_TYPE = "job_type";
  private static final String MDC_TRACE_ID = "trace_id";

  private final NotificationJobRepository jobRepository;
  private final DeadLetterRepository deadLetterRepository;
  private final JobEligibilityService eligibilityService;
  private final ChannelDispatcher channelDispatcher;
  private final DelayFollowUpChainer delayFollowUpChainer;
  private final ReminderFailureRecorder reminderFailureRecorder;
  private final NotificationErrorClassifier errorClassifier;
  private final NotificationMetrics metrics;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public int processDueJobs() {
    return processDueJobs(properties.batchSize());
  }

  /**
   * Claims up to {@code limit} due jobs and processes them one by one; returns the claim size.
   * Each member's lease is renewed right before its attempt, and a member whose lease was taken
   * over while earlier members were dispatching is left to its new holder.
   */
  public int processDueJobs(int limit) {
    final Instant now = Instant.now(clock);
    final String lockedBy = newClaimToken();
    final List<NotificationJob> claimed =
        jobRepository.claimDue(limit, now, now.plus(properties.lease()), lockedBy);
    for (NotificationJob job : claimed) {
      final Instant renewedAt = Instant.now(clock);
      final int renewed =
          jobRepository.renewLease(
              job.jobId(), renewedAt, renewedAt.plus(properties.lease()), lockedBy);
      if (renewed == 0) {
        logger.warn("notification lease lost before dispatch jobId={}", job.jobId());
        continue;
      }
      process(job, lockedBy);
    }
    metrics.updateBacklogCurrent(jobRepository.countDueQueued(Instant.now(clock)));
    return claimed.size();
  }

  /** Processes one job if it is still queued and due; a no-op otherwise. */
  public void processJob(String jobId) {
    final Instant now = Instant.now(clock);
    final String lockedBy = newClaimToken();
    final Optional<NotificationJob> claimed =
        jobRepository.claimById(jobId, now, now.plus(properties.lease()), lockedBy);
    if (claimed.isEmpty()) {
      logger.debug("notification job not claimable jobId={}", jobId);
      return;
    }
    process(claimed.get(), lockedBy);
  }

  private void process(NotificationJob job, String lockedBy) {
    MDC.put(MDC_JOB_ID, job.jobId());
    MDC.put(MDC_JOB_TYPE, job.type().name());
    MDC.put(MDC_TRACE_ID, TraceIds.newTraceId());
    try {
      final Eligibility eligibility = eligibilityService.evaluate(job);
      if (eligibility.skipped()) {
        final int updated =
            jobRepository.markSkipped(
                job.jobId(), eligibility.skipReason().name(), Instant.now(clock), lockedBy);
        if (updated == 0) {
          logger.warn("notification skip lost its lock jobId={}", job.jobId());
        }
        metrics.recordJobOutcome("skipped");
        logger.info(
            "notification job skipped jobId={} reason={}", job.jobId(), eligibility.skipReason());
        return;
      }

      final Instant started = Instant.now(clock);
      final List<String> warnings = channelDispatcher.dispatch(job, eligibility.channels());
      metrics.recordDispatchDuration(Duration.between(started, Instant.now(clock)));
      if (eligibility.routing() != null) {
        delayFollowUpChainer.scheduleNext(job, eligibility.routing());
      }

      final int updated =
          jobRepository.markDone(
              job.jobId(),
              warnings.isEmpty() ? null : truncateError(String.join(",", warnings)),
              Instant.now(clock),
              lockedBy);
      if (updated == 0) {
        logger.warn("notification sent but lock was lost jobId={}", job.jobId());
      }
      metrics.recordJobOutcome("done");
      if (!warnings.isEmpty()) {
        logger.warn(
            "notification job done with warnings jobId={} warnings={}", job.jobId(), warnings);
      }
    } catch (RuntimeException ex) {
      handleFailure(job, ex, lockedBy);
    } finally {
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_JOB_TYPE);
      MDC.remove(MDC_TRACE_ID);
    }
  }

  @VisibleForTesting
  void handleFailure(NotificationJob job, RuntimeException ex, String lockedBy) {
    final Instant now = Instant.now(clock);
    final NotificationErrorClass errorClass = errorClassifier.classify(ex);
    final String rawMessage = ex.getMessage() == null ? "unknown error" : ex.getMessage();
    final String lastError = truncateError(errorClass.wireName() + ": " + rawMessage);
    final int attempt = job.attemptCount();

    if (errorClass.isRetryable() && attempt < properties.maxAttempts()) {
      final Instant runAfter = now.plus(computeBackoffDuration(attempt));
      final int updated =
          jobRepository.markRetry(job.jobId(), runAfter, lastError, errorClass, now, lockedBy);
      if (updated == 0) {
        logger.warn(
            "notification retry skipped because lock was lost jobId={} attempt={}",
            job.jobId(),
            attempt);
        return;
      }
      metrics.recordJobOutcome("retry");
      logger.warn(
          "notification retry scheduled jobId={} attempt={} errorClass={} runAfter={}",
          job.jobId(),
          attempt,
          errorClass.wireName(),
          runAfter,
          ex);
      return;
    }

    final boolean moved =
        moveToDeadLetterAndMarkFailed(
            job, errorClass, lastError, truncateError(rawMessage), now, lockedBy);
    if (!moved) {
      logger.warn(
          "notification dead letter skipped because lock was lost jobId={}", job.jobId());
      return;
    }
    metrics.recordJobOutcome("failed");
    metrics.recordDeadLetter();
    logger.error(
        "notification job moved to dead letter jobId={} errorClass={} attempt={}",
        job.jobId(),
        errorClass.wireName(),
        attempt,
        ex);
    try {
      reminderFailureRecorder.record(job, errorClass, rawMessage);
    } catch (RuntimeException recordError) {
      logger.error(
          "pickup reminder failure audit could not be written jobId={}", job.jobId(), recordError);
    }
  }

  private boolean moveToDeadLetterAndMarkFailed(
      NotificationJob job,
      NotificationErrorClass errorClass,
      String lastError,
      String errorMessage,
      Instant now,
      String lockedBy) {
    // dead letter and FAILED commit together; a lost lock rolls both back
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean moved =
        transactionTemplate.execute(
            status -> {
              deadLetterRepository.insert(
                  new DeadLetterRecord(
                      job.jobId(),
                      job.dedupeKey(),
                      job.uid(),
                      job.type(),
                      job.payload(),
                      job.channels(),
                      job.attemptCount(),
                      errorClass,
                      errorMessage,
                      now));
              final int count =
                  jobRepository.markFailed(job.jobId(), lastError, errorClass, now, lockedBy);
              if (count == 0) {
                status.setRollbackOnly();
                return false;
              }
              return true;
            });
    return Boolean.TRUE.equals(moved);
  }

  /** base * exponentBase^(attempt-1), capped, then scaled by a jitter factor. */
  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp =
        baseMillis * Math.pow(properties.backoffExponentBase(), Math.max(0, attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  /** Host name plus a random suffix, so two claims on the same host never share a lock owner. */
  @VisibleForTesting
  String newClaimToken() {
    return resolveHostname() + ":" + UUID.randomUUID();
  }

  private String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
