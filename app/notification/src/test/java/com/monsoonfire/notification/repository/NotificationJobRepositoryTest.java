/*
 * Where: Notification repository integration tests
 * What: Insert-if-absent, claiming and lock-guarded transitions on Postgres
 * Why: Claim and lease semantics depend on the SQL dialect
 */
package com.monsoonfire.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.AbstractPostgresContainerTest;
import com.monsoonfire.notification.model.DeliveryChannels;
import com.monsoonfire.notification.model.JobStatus;
import com.monsoonfire.notification.model.NotificationErrorClass;
import com.monsoonfire.notification.model.NotificationJob;
import com.monsoonfire.notification.model.NotificationJobType;
import com.monsoonfire.notification.model.NotificationPayload;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationJobRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");
  private static final Duration LEASE = Duration.ofMinutes(5);
  private static final String WORKER = "worker-a";

  @Autowired private NotificationJobRepository jobRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentKeepsFirstJobForDedupeKey() {
    final NotificationJob first = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);

    assertThat(jobRepository.insertIfAbsent(first)).isTrue();
    assertThat(jobRepository.insertIfAbsent(first)).isFalse();

    final NotificationJob stored = jobRepository.findById(first.jobId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.QUEUED);
    assertThat(stored.attemptCount()).isZero();
    assertThat(stored.channels()).isEqualTo(DeliveryChannels.inAppOnly());
    assertThat(stored.payload().firingId()).isEqualTo("firing-1");
    assertThat(stored.runAfter()).isEqualTo(BASE_TIME);
  }

  @Test
  void claimDueTakesOnlyDueJobsAndCountsTheAttempt() {
    final NotificationJob due = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);
    final NotificationJob future =
        queued("KILN_UNLOADED:firing-2:user-1", BASE_TIME.plus(Duration.ofHours(1)));
    jobRepository.insertIfAbsent(due);
    jobRepository.insertIfAbsent(future);

    final List<NotificationJob> claimed =
        jobRepository.claimDue(10, BASE_TIME, BASE_TIME.plus(LEASE), WORKER);

    assertThat(claimed).extracting(NotificationJob::jobId).containsExactly(due.jobId());
    assertThat(claimed.get(0).status()).isEqualTo(JobStatus.PROCESSING);
    assertThat(claimed.get(0).attemptCount()).isEqualTo(1);
    assertThat(claimed.get(0).lockedBy()).isEqualTo(WORKER);
    assertThat(jobRepository.countDueQueued(BASE_TIME)).isZero();
  }

  @Test
  void expiredLeaseIsReclaimedByAnotherWorker() {
    final NotificationJob job = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);
    jobRepository.insertIfAbsent(job);
    jobRepository.claimDue(10, BASE_TIME, BASE_TIME.plus(LEASE), WORKER);

    assertThat(jobRepository.claimDue(10, BASE_TIME.plusSeconds(60), BASE_TIME, "worker-b"))
        .isEmpty();

    final Instant afterLease = BASE_TIME.plus(LEASE).plusSeconds(1);
    final List<NotificationJob> reclaimed =
        jobRepository.claimDue(10, afterLease, afterLease.plus(LEASE), "worker-b");

    assertThat(reclaimed).hasSize(1);
    assertThat(reclaimed.get(0).attemptCount()).isEqualTo(2);
    assertThat(reclaimed.get(0).lockedBy()).isEqualTo("worker-b");
  }

  @Test
  void transitionsRequireTheCurrentLockOwner() {
    final NotificationJob job = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);
    jobRepository.insertIfAbsent(job);
    jobRepository.claimById(job.jobId(), BASE_TIME, BASE_TIME.plus(LEASE), WORKER);
    final Instant retryAt = BASE_TIME.plus(Duration.ofMinutes(1));

    assertThat(
            jobRepository.markRetry(
                job.jobId(),
                retryAt,
                "503",
                NotificationErrorClass.PROVIDER_5XX,
                BASE_TIME,
                "worker-b"))
        .isZero();
    assertThat(
            jobRepository.markRetry(
                job.jobId(),
                retryAt,
                "503",
                NotificationErrorClass.PROVIDER_5XX,
                BASE_TIME,
                WORKER))
        .isEqualTo(1);

    final NotificationJob stored = jobRepository.findById(job.jobId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.QUEUED);
    assertThat(stored.runAfter()).isEqualTo(retryAt);
    assertThat(stored.lastErrorClass()).isEqualTo(NotificationErrorClass.PROVIDER_5XX);
    assertThat(stored.lockedBy()).isNull();
    assertThat(stored.leaseUntil()).isNull();
  }

  @Test
  void leaseRenewalKeepsTheJobAwayFromOtherClaims() {
    final NotificationJob job = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);
    jobRepository.insertIfAbsent(job);
    jobRepository.claimDue(10, BASE_TIME, BASE_TIME.plus(LEASE), WORKER);
    final Instant renewedAt = BASE_TIME.plus(Duration.ofMinutes(4));

    assertThat(jobRepository.renewLease(job.jobId(), renewedAt, renewedAt.plus(LEASE), WORKER))
        .isEqualTo(1);

    final Instant afterFirstLease = BASE_TIME.plus(LEASE).plusSeconds(1);
    assertThat(
            jobRepository.claimDue(
                10, afterFirstLease, afterFirstLease.plus(LEASE), "worker-b"))
        .isEmpty();
  }

  @Test
  void leaseRenewalFailsAfterAnotherClaimTookTheJob() {
    final NotificationJob job = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);
    jobRepository.insertIfAbsent(job);
    jobRepository.claimDue(10, BASE_TIME, BASE_TIME.plus(LEASE), WORKER);
    final Instant afterLease = BASE_TIME.plus(LEASE).plusSeconds(1);
    jobRepository.claimDue(10, afterLease, afterLease.plus(LEASE), "worker-b");

    assertThat(jobRepository.renewLease(job.jobId(), afterLease, afterLease.plus(LEASE), WORKER))
        .isZero();
    assertThat(jobRepository.findById(job.jobId()).orElseThrow().lockedBy())
        .isEqualTo("worker-b");
  }

  @Test
  void claimByIdIgnoresJobsThatAreNotDue() {
    final NotificationJob job =
        queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME.plus(Duration.ofHours(1)));
    jobRepository.insertIfAbsent(job);

    assertThat(jobRepository.claimById(job.jobId(), BASE_TIME, BASE_TIME.plus(LEASE), WORKER))
        .isEmpty();
  }

  @Test
  void retentionQueriesSeparateTerminalFromActiveJobs() {
    final NotificationJob done = queued("KILN_UNLOADED:firing-1:user-1", BASE_TIME);
    final NotificationJob stuck = queued("KILN_UNLOADED:firing-2:user-1", BASE_TIME);
    jobRepository.insertIfAbsent(done);
    jobRepository.insertIfAbsent(stuck);
    jobRepository.claimById(done.jobId(), BASE_TIME, BASE_TIME.plus(LEASE), WORKER);
    jobRepository.markDone(done.jobId(), null, BASE_TIME, WORKER);
    final Instant threshold = BASE_TIME.plus(Duration.ofDays(1));

    assertThat(jobRepository.countStaleActive(threshold)).isEqualTo(1);
    assertThat(jobRepository.deleteTerminalOlderThan(threshold)).isEqualTo(1);
    assertThat(jobRepository.findById(done.jobId())).isEmpty();
    assertThat(jobRepository.findById(stuck.jobId())).isPresent();
  }

  private static NotificationJob queued(String dedupeKey, Instant runAfter) {
    final String firingId = dedupeKey.split(":")[1];
    return new NotificationJob(
        DedupeHashes.sha256Hex(dedupeKey),
        dedupeKey,
        NotificationJobType.KILN_UNLOADED,
        "user-1",
        DeliveryChannels.inAppOnly(),
        NotificationPayload.builder().firingId(firingId).build(),
        JobStatus.QUEUED,
        runAfter,
        0,
        null,
        null,
        null,
        null,
        BASE_TIME,
        BASE_TIME);
  }
}
