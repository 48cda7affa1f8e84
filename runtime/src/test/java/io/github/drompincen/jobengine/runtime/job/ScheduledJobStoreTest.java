package io.github.drompincen.jobengine.runtime.job;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.persistence.repository.ScheduledJobRepository;
import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import io.github.drompincen.jobengine.protocol.api.NotifyPayload;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import io.github.drompincen.jobengine.runtime.TestMongoConfiguration;
import io.github.drompincen.jobengine.runtime.error.ConflictingScheduleFieldsException;
import io.github.drompincen.jobengine.runtime.error.IllegalJobTransitionException;
import io.github.drompincen.jobengine.runtime.error.InvalidActionPayloadException;
import io.github.drompincen.jobengine.runtime.error.JobNotFoundException;
import io.github.drompincen.jobengine.runtime.schedule.RecurrenceEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.ContextConfiguration;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static io.github.drompincen.jobengine.runtime.TestMongoConfiguration.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest
@ActiveProfiles("test")
@ContextConfiguration(classes = TestMongoConfiguration.class)
@Import({ScheduledJobStore.class, RecurrenceEvaluator.class})
class ScheduledJobStoreTest {

    private static final Duration LEASE = Duration.ofMinutes(5);

    @Autowired private ScheduledJobStore store;
    @Autowired private ScheduledJobRepository repository;

    @BeforeEach
    void cleanDatabase() {
        repository.deleteAll();
    }

    // ------------------------------------------------------------------
    // create / get
    // ------------------------------------------------------------------

    @Test
    void create_onceJob_usesRunAtAsNextRun() {
        ScheduledJobDocument job = store.create(once("alice", NOW.plusSeconds(3600)));

        assertThat(job.getJobId()).isNotBlank();
        assertThat(job.getStatus()).isEqualTo(JobStatus.ACTIVE);
        assertThat(job.getNextRunAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(job.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void create_cronJob_computesNextRunInZone() {
        ScheduledJobDocument job = store.create(cron("alice", "0 8 * * *"));
        assertThat(job.getNextRunAt()).isEqualTo(Instant.parse("2026-03-05T13:00:00Z"));
    }

    @Test
    void create_rejectsPayloadWithoutMessage() {
        ScheduledJobDocument draft = once("alice", NOW.plusSeconds(60));
        draft.setActionPayload(Map.of());
        assertThatThrownBy(() -> store.create(draft)).isInstanceOf(InvalidActionPayloadException.class);
        assertThat(repository.count()).isZero();
    }

    @Test
    void create_rejectsBothScheduleFields() {
        ScheduledJobDocument draft = once("alice", NOW.plusSeconds(60));
        draft.setCronExpression("0 8 * * *");
        assertThatThrownBy(() -> store.create(draft)).isInstanceOf(ConflictingScheduleFieldsException.class);
    }

    @Test
    void getById_otherOwner_isNotFound() {
        ScheduledJobDocument job = store.create(once("alice", NOW.plusSeconds(60)));
        assertThatThrownBy(() -> store.getById("bob", job.getJobId())).isInstanceOf(JobNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // claims
    // ------------------------------------------------------------------

    @Test
    void claimDue_picksOnlyActiveDueJobs() {
        ScheduledJobDocument due = store.create(once("alice", NOW.minusSeconds(10)));
        store.create(once("alice", NOW.plusSeconds(600)));
        ScheduledJobDocument paused = store.create(once("alice", NOW.minusSeconds(10)));
        store.update("alice", paused.getJobId(), JobUpdate.status(JobStatus.PAUSED));
        ScheduledJobDocument cancelled = store.create(once("alice", NOW.minusSeconds(10)));
        store.update("alice", cancelled.getJobId(), JobUpdate.cancel(null));

        List<ClaimedJob> claimed = store.claimDue(10, NOW);

        assertThat(claimed).extracting(ClaimedJob::jobId).containsExactly(due.getJobId());
        ClaimedJob claim = claimed.get(0);
        assertThat(claim.claimedUntil()).isEqualTo(NOW.plus(LEASE));
        assertThat(claim.job().getClaimToken()).isEqualTo(claim.claimToken());
        assertThat(claim.job().getClaimedBy()).isEqualTo(store.getWorkerId());
    }

    @Test
    void claimDue_respectsLimit_oldestFirst() {
        ScheduledJobDocument older = store.create(once("alice", NOW.minusSeconds(120)));
        store.create(once("alice", NOW.minusSeconds(60)));

        List<ClaimedJob> claimed = store.claimDue(1, NOW);
        assertThat(claimed).extracting(ClaimedJob::jobId).containsExactly(older.getJobId());
    }

    @Test
    void claimedJob_isReclaimableOnlyAfterLeaseExpires() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob first = store.claimDue(10, NOW).get(0);

        assertThat(store.claimDue(10, NOW.plusSeconds(60))).isEmpty();

        List<ClaimedJob> again = store.claimDue(10, NOW.plus(LEASE).plusSeconds(1));
        assertThat(again).hasSize(1);
        assertThat(again.get(0).claimToken()).isNotEqualTo(first.claimToken());
    }

    @Test
    void concurrentClaims_neverHandTheSameJobToTwoCallers() throws Exception {
        for (int i = 0; i < 30; i++) {
            store.create(once("alice", NOW.minusSeconds(i + 1)));
        }

        int callers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<ClaimedJob>>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Callable<List<ClaimedJob>> claimer = () -> {
                start.await();
                return store.claimDue(30, NOW);
            };
            results.add(pool.submit(claimer));
        }
        start.countDown();

        Set<String> seen = new HashSet<>();
        int total = 0;
        for (Future<List<ClaimedJob>> result : results) {
            for (ClaimedJob claim : result.get()) {
                seen.add(claim.jobId());
                total++;
            }
        }
        pool.shutdown();

        assertThat(total).isEqualTo(30);
        assertThat(seen).hasSize(30);
    }

    // ------------------------------------------------------------------
    // dispatcher outcomes
    // ------------------------------------------------------------------

    @Test
    void markCompleted_onceJobIsNeverClaimedAgain() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        assertThat(store.markCompleted(claim, false)).isTrue();

        ScheduledJobDocument done = repository.findById(claim.jobId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.isFailed()).isFalse();
        assertThat(done.getClaimToken()).isNull();
        assertThat(store.claimDue(10, NOW.plus(Duration.ofDays(1)))).isEmpty();
    }

    @Test
    void markCompleted_keepsCancellationMadeWhileInFlight() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        store.update("alice", claim.jobId(), JobUpdate.cancel("changed my mind"));
        store.markCompleted(claim, false);

        ScheduledJobDocument job = repository.findById(claim.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getCancelReason()).isEqualTo("changed my mind");
        assertThat(job.getClaimToken()).isNull();
    }

    @Test
    void reschedule_keepsPauseMadeWhileInFlight() {
        ScheduledJobDocument created = store.create(cron("alice", "0 8 * * *"));
        forceNextRun(created.getJobId(), NOW.minusSeconds(10));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        store.update("alice", claim.jobId(), JobUpdate.status(JobStatus.PAUSED));
        store.reschedule(claim, Instant.parse("2026-03-06T13:00:00Z"));

        ScheduledJobDocument job = repository.findById(claim.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PAUSED);
        assertThat(job.getNextRunAt()).isEqualTo(Instant.parse("2026-03-06T13:00:00Z"));
    }

    @Test
    void reschedule_withTakenOverClaim_isRejected() {
        store.create(cron("alice", "0 8 * * *"));
        forceNextRun(repository.findAll().get(0).getJobId(), NOW.minusSeconds(10));

        ClaimedJob stale = store.claimDue(10, NOW).get(0);
        ClaimedJob current = store.claimDue(10, NOW.plus(LEASE).plusSeconds(1)).get(0);

        assertThat(store.reschedule(stale, NOW.plus(Duration.ofDays(30)))).isFalse();
        assertThat(store.reschedule(current, Instant.parse("2026-03-06T13:00:00Z"))).isTrue();
        assertThat(repository.findById(current.jobId()).orElseThrow().getNextRunAt())
                .isEqualTo(Instant.parse("2026-03-06T13:00:00Z"));
    }

    @Test
    void renewClaim_extendsLease_soQueuedJobIsNotReclaimed() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        // Still waiting for a worker four minutes in
        Instant queuedUntil = NOW.plus(Duration.ofMinutes(4));
        assertThat(store.renewClaim(claim, queuedUntil)).isTrue();

        assertThat(store.claimDue(10, NOW.plus(LEASE).plusSeconds(1))).isEmpty();
        assertThat(repository.findById(claim.jobId()).orElseThrow().getClaimedUntil())
                .isEqualTo(queuedUntil.plus(LEASE));
    }

    @Test
    void renewClaim_afterTakeOver_fails() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob stale = store.claimDue(10, NOW).get(0);
        ClaimedJob current = store.claimDue(10, NOW.plus(LEASE).plusSeconds(1)).get(0);

        assertThat(store.renewClaim(stale, NOW.plus(LEASE).plusSeconds(2))).isFalse();
        assertThat(store.renewClaim(current, NOW.plus(LEASE).plusSeconds(2))).isTrue();
    }

    @Test
    void renewClaim_afterLeaseExpiry_succeedsWhileNobodyElseClaimed() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        assertThat(store.renewClaim(claim, NOW.plus(LEASE).plusSeconds(60))).isTrue();
        assertThat(store.claimDue(10, NOW.plus(LEASE).plusSeconds(61))).isEmpty();
    }

    @Test
    void recordFailure_tracksConsecutiveFailures_andSuccessResets() {
        store.create(cron("alice", "0 8 * * *"));
        forceNextRun(repository.findAll().get(0).getJobId(), NOW.minusSeconds(10));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        store.recordFailure(claim, NOW, "boom");
        ScheduledJobDocument afterTwo = store.recordFailure(claim, NOW, "boom again").orElseThrow();
        assertThat(afterTwo.getConsecutiveFailures()).isEqualTo(2);
        assertThat(afterTwo.getFailureCount()).isEqualTo(2);
        assertThat(afterTwo.getLastError()).isEqualTo("boom again");
        assertThat(afterTwo.getRunCount()).isEqualTo(2);

        ScheduledJobDocument afterSuccess = store.recordSuccess(claim, NOW).orElseThrow();
        assertThat(afterSuccess.getConsecutiveFailures()).isZero();
        assertThat(afterSuccess.getFailureCount()).isEqualTo(2);
    }

    @Test
    void cancelByEngine_recordsReason() {
        store.create(cron("alice", "0 8 * * *"));
        forceNextRun(repository.findAll().get(0).getJobId(), NOW.minusSeconds(10));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        assertThat(store.cancelByEngine(claim, "no more occurrences")).isTrue();
        ScheduledJobDocument job = repository.findById(claim.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getCancelReason()).isEqualTo("no more occurrences");
    }

    // ------------------------------------------------------------------
    // lifecycle updates
    // ------------------------------------------------------------------

    @Test
    void pause_keepsNextRun_andResumeOfCronRecomputesFromNow() {
        ScheduledJobDocument created = store.create(cron("alice", "0 8 * * *"));
        forceNextRun(created.getJobId(), NOW.minus(Duration.ofDays(3)));

        ScheduledJobDocument paused = store.update("alice", created.getJobId(), JobUpdate.status(JobStatus.PAUSED));
        assertThat(paused.getNextRunAt()).isEqualTo(NOW.minus(Duration.ofDays(3)));
        assertThat(store.claimDue(10, NOW)).isEmpty();

        ScheduledJobDocument resumed = store.update("alice", created.getJobId(), JobUpdate.status(JobStatus.ACTIVE));
        assertThat(resumed.getNextRunAt()).isEqualTo(Instant.parse("2026-03-05T13:00:00Z"));
    }

    @Test
    void resumeOfOnceJob_keepsOverdueNextRun() {
        ScheduledJobDocument created = store.create(once("alice", NOW.minusSeconds(30)));
        store.update("alice", created.getJobId(), JobUpdate.status(JobStatus.PAUSED));
        ScheduledJobDocument resumed = store.update("alice", created.getJobId(), JobUpdate.status(JobStatus.ACTIVE));

        assertThat(resumed.getNextRunAt()).isEqualTo(NOW.minusSeconds(30));
        assertThat(store.claimDue(10, NOW)).hasSize(1);
    }

    @Test
    void cancelOfTerminalJob_isNoOp_butPauseIsIllegal() {
        ScheduledJobDocument created = store.create(once("alice", NOW.plusSeconds(30)));
        store.update("alice", created.getJobId(), JobUpdate.cancel("first"));

        ScheduledJobDocument again = store.update("alice", created.getJobId(), JobUpdate.cancel("second"));
        assertThat(again.getCancelReason()).isEqualTo("first");

        assertThatThrownBy(() -> store.update("alice", created.getJobId(), JobUpdate.status(JobStatus.PAUSED)))
                .isInstanceOf(IllegalJobTransitionException.class);
    }

    @Test
    void scheduleChange_switchesTypeAndRecomputes() {
        ScheduledJobDocument created = store.create(once("alice", NOW.plusSeconds(30)));

        ScheduledJobDocument recurring = store.update("alice", created.getJobId(),
                JobUpdate.schedule(null, "0 8 * * *", "UTC"));

        assertThat(recurring.getScheduleType()).isEqualTo(ScheduleType.CRON);
        assertThat(recurring.getRunAt()).isNull();
        assertThat(recurring.getTimezone()).isEqualTo("UTC");
        assertThat(recurring.getNextRunAt()).isEqualTo(Instant.parse("2026-03-06T08:00:00Z"));
    }

    @Test
    void update_whileClaimed_keepsClaim() {
        store.create(once("alice", NOW.minusSeconds(10)));
        ClaimedJob claim = store.claimDue(10, NOW).get(0);

        store.update("alice", claim.jobId(), JobUpdate.details("renamed", null));

        ScheduledJobDocument job = repository.findById(claim.jobId()).orElseThrow();
        assertThat(job.getTitle()).isEqualTo("renamed");
        assertThat(job.getClaimToken()).isEqualTo(claim.claimToken());
        assertThat(store.markCompleted(claim, false)).isTrue();
    }

    private void forceNextRun(String jobId, Instant nextRunAt) {
        ScheduledJobDocument doc = repository.findById(jobId).orElseThrow();
        doc.setNextRunAt(nextRunAt);
        repository.save(doc);
    }

    private static ScheduledJobDocument once(String owner, Instant runAt) {
        ScheduledJobDocument doc = base(owner);
        doc.setJobKind(JobKind.REMINDER);
        doc.setScheduleType(ScheduleType.ONCE);
        doc.setRunAt(runAt);
        return doc;
    }

    private static ScheduledJobDocument cron(String owner, String expression) {
        ScheduledJobDocument doc = base(owner);
        doc.setJobKind(JobKind.RECURRING);
        doc.setScheduleType(ScheduleType.CRON);
        doc.setCronExpression(expression);
        return doc;
    }

    private static ScheduledJobDocument base(String owner) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setOwnerId(owner);
        doc.setTimezone("America/New_York");
        doc.setActionType(ActionType.NOTIFY);
        doc.setActionPayload(new NotifyPayload("ping", null).toMap());
        doc.setTitle("ping");
        return doc;
    }
}
