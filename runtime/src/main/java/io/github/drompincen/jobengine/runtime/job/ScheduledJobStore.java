package io.github.drompincen.jobengine.runtime.job;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.persistence.repository.ScheduledJobRepository;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import io.github.drompincen.jobengine.runtime.error.ConflictingScheduleFieldsException;
import io.github.drompincen.jobengine.runtime.error.IllegalJobTransitionException;
import io.github.drompincen.jobengine.runtime.error.InvalidScheduleException;
import io.github.drompincen.jobengine.runtime.error.JobNotFoundException;
import io.github.drompincen.jobengine.runtime.schedule.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable home of scheduled jobs. Authoring writes go through {@link #create} and
 * {@link #update}; the dispatcher moves jobs out of "due" only through the claim-token
 * guarded operations.
 */
@Service
public class ScheduledJobStore {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobStore.class);
    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private final ScheduledJobRepository repository;
    private final MongoTemplate mongoTemplate;
    private final RecurrenceEvaluator evaluator;
    private final Clock clock;
    private final Duration lease;
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    public ScheduledJobStore(ScheduledJobRepository repository,
                             MongoTemplate mongoTemplate,
                             RecurrenceEvaluator evaluator,
                             Clock clock,
                             @Value("${jobengine.dispatcher.lease-ms:300000}") long leaseMs) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
        this.evaluator = evaluator;
        this.clock = clock;
        this.lease = Duration.ofMillis(leaseMs);
    }

    public String getWorkerId() {
        return workerId;
    }

    // --- authoring side ---

    public ScheduledJobDocument create(ScheduledJobDocument job) {
        checkScheduleFields(job.getScheduleType(), job.getRunAt(), job.getCronExpression());
        ActionPayloads.validate(job.getActionType(), job.getActionPayload());

        Instant now = clock.instant();
        job.setJobId(UUID.randomUUID().toString());
        job.setStatus(JobStatus.ACTIVE);
        job.setNextRunAt(job.getScheduleType() == ScheduleType.ONCE
                ? job.getRunAt()
                : evaluator.nextRun(job.getCronExpression(), job.getTimezone(), now));
        job.setVersion(null);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        ScheduledJobDocument saved = repository.save(job);
        log.info("Created {} job {} for owner {} (next run {})",
                saved.getScheduleType(), saved.getJobId(), saved.getOwnerId(), saved.getNextRunAt());
        return saved;
    }

    public ScheduledJobDocument getById(String ownerId, String jobId) {
        return repository.findByJobIdAndOwnerId(jobId, ownerId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<ScheduledJobDocument> listByOwner(String ownerId, JobStatus status, JobKind jobKind, int limit) {
        Pageable page = PageRequest.of(0, Math.max(1, limit));
        if (status != null && jobKind != null) {
            return repository.findByOwnerIdAndStatusAndJobKindOrderByNextRunAtAsc(ownerId, status, jobKind, page);
        }
        if (status != null) {
            return repository.findByOwnerIdAndStatusOrderByNextRunAtAsc(ownerId, status, page);
        }
        if (jobKind != null) {
            return repository.findByOwnerIdAndJobKindOrderByNextRunAtAsc(ownerId, jobKind, page);
        }
        return repository.findByOwnerIdOrderByNextRunAtAsc(ownerId, page);
    }

    /**
     * Applies a partial update. Retries on a concurrent version bump, which happens when the
     * dispatcher claims or finishes the job between our read and write.
     */
    public ScheduledJobDocument update(String ownerId, String jobId, JobUpdate update) {
        OptimisticLockingFailureException last = null;
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            ScheduledJobDocument job = getById(ownerId, jobId);
            if (!apply(job, update)) {
                return job;
            }
            job.setUpdatedAt(clock.instant());
            try {
                return repository.save(job);
            } catch (OptimisticLockingFailureException e) {
                log.debug("Concurrent modification of job {} (attempt {})", jobId, attempt);
                last = e;
            }
        }
        throw last;
    }

    /** Returns false when the update is a no-op and nothing needs saving. */
    private boolean apply(ScheduledJobDocument job, JobUpdate update) {
        Instant now = clock.instant();
        JobStatus current = job.getStatus();

        if (update.getStatus() == JobStatus.CANCELLED) {
            if (current.isTerminal()) return false;
            job.setStatus(JobStatus.CANCELLED);
            job.setCancelReason(update.getCancelReason());
            log.info("Cancelled job {} (was {})", job.getJobId(), current);
            return true;
        }

        boolean changed = false;
        if (update.getStatus() != null) {
            changed = applyStatus(job, update.getStatus(), now);
        }

        if (update.changesSchedule()) {
            if (job.getStatus().isTerminal()) {
                throw new IllegalJobTransitionException(
                        "Cannot reschedule job " + job.getJobId() + " in status " + job.getStatus());
            }
            applySchedule(job, update, now);
            changed = true;
        }

        if (update.getTitle() != null) {
            job.setTitle(update.getTitle());
            changed = true;
        }
        if (update.getDescription() != null) {
            job.setDescription(update.getDescription());
            changed = true;
        }
        return changed;
    }

    private boolean applyStatus(ScheduledJobDocument job, JobStatus target, Instant now) {
        JobStatus current = job.getStatus();
        if (target == JobStatus.COMPLETED) {
            throw new IllegalJobTransitionException("Jobs are completed only by the dispatcher");
        }
        if (current.isTerminal()) {
            throw new IllegalJobTransitionException(
                    "Job " + job.getJobId() + " is " + current + " and cannot become " + target);
        }
        if (current == target) return false;

        job.setStatus(target);
        if (target == JobStatus.ACTIVE && job.getScheduleType() == ScheduleType.CRON) {
            // Occurrences missed while paused are not replayed
            job.setNextRunAt(evaluator.nextRun(job.getCronExpression(), job.getTimezone(), now));
        }
        log.info("Job {} {} -> {}", job.getJobId(), current, target);
        return true;
    }

    private void applySchedule(ScheduledJobDocument job, JobUpdate update, Instant now) {
        if (update.getRunAt() != null && update.getCronExpression() != null) {
            throw new ConflictingScheduleFieldsException("Provide either runAt or cronExpression, not both");
        }
        if (update.getTimezone() != null) {
            evaluator.zone(update.getTimezone());
            job.setTimezone(update.getTimezone());
        }
        if (update.getRunAt() != null) {
            job.setScheduleType(ScheduleType.ONCE);
            job.setRunAt(update.getRunAt());
            job.setCronExpression(null);
            if (job.getJobKind() == JobKind.RECURRING) job.setJobKind(JobKind.ONE_TIME);
        } else if (update.getCronExpression() != null) {
            job.setScheduleType(ScheduleType.CRON);
            job.setCronExpression(update.getCronExpression());
            job.setRunAt(null);
            if (job.getJobKind() == JobKind.ONE_TIME) job.setJobKind(JobKind.RECURRING);
        }

        if (job.getScheduleType() == ScheduleType.ONCE) {
            job.setNextRunAt(job.getRunAt());
        } else {
            job.setNextRunAt(evaluator.nextRun(job.getCronExpression(), job.getTimezone(), now));
        }
    }

    private void checkScheduleFields(ScheduleType type, Instant runAt, String cronExpression) {
        if (type == null) {
            throw new InvalidScheduleException("Schedule type is required");
        }
        if (runAt != null && cronExpression != null) {
            throw new ConflictingScheduleFieldsException("Provide either runAt or cronExpression, not both");
        }
        if (type == ScheduleType.ONCE && runAt == null) {
            throw new InvalidScheduleException("A one-shot job requires runAt");
        }
        if (type == ScheduleType.CRON && cronExpression == null) {
            throw new InvalidScheduleException("A recurring job requires cronExpression");
        }
    }

    // --- dispatcher side ---

    /**
     * Atomically claims up to {@code limit} due jobs, one conditional update per job. A job
     * whose previous claim lease has run out is claimable again.
     */
    public List<ClaimedJob> claimDue(int limit, Instant now) {
        List<ClaimedJob> claimed = new ArrayList<>();
        Instant claimedUntil = now.plus(lease);
        for (int i = 0; i < limit; i++) {
            Query query = new Query(new Criteria().andOperator(
                    Criteria.where("status").is(JobStatus.ACTIVE),
                    Criteria.where("nextRunAt").lte(now),
                    new Criteria().orOperator(
                            Criteria.where("claimedUntil").is(null),
                            Criteria.where("claimedUntil").lt(now))))
                    .with(Sort.by(Sort.Direction.ASC, "nextRunAt"));

            String token = UUID.randomUUID().toString();
            Update claim = new Update()
                    .set("claimedBy", workerId)
                    .set("claimToken", token)
                    .set("claimedUntil", claimedUntil)
                    .inc("version", 1);

            ScheduledJobDocument job = mongoTemplate.findAndModify(query, claim,
                    FindAndModifyOptions.options().returnNew(true), ScheduledJobDocument.class);
            if (job == null) break;
            claimed.add(new ClaimedJob(job, token, claimedUntil));
        }
        if (!claimed.isEmpty()) {
            log.info("Worker {} claimed {} due jobs", workerId, claimed.size());
        }
        return claimed;
    }

    /**
     * Extends the claim lease to {@code now + lease} if the claim token is still ours. Fails
     * once another worker has re-claimed the job after the lease ran out; the caller must then
     * leave the job alone.
     */
    public boolean renewClaim(ClaimedJob claim, Instant now) {
        Update update = new Update()
                .set("claimedUntil", now.plus(lease))
                .inc("version", 1);
        if (mongoTemplate.updateFirst(claimQuery(claim), update, ScheduledJobDocument.class).getMatchedCount() == 0) {
            log.warn("Worker {} lost its claim on job {}; another worker owns it now", workerId, claim.jobId());
            return false;
        }
        return true;
    }

    /** Sets the next occurrence and releases the claim. Status is never touched. */
    public boolean reschedule(ClaimedJob claim, Instant newNextRunAt) {
        Update update = release()
                .set("nextRunAt", newNextRunAt);
        return updateClaimed(claim, update, "reschedule");
    }

    public boolean markCompleted(ClaimedJob claim, boolean failed) {
        return markCompleted(claim, failed, null);
    }

    /**
     * Finalizes a one-shot dispatch. A job cancelled while it was in flight keeps its
     * CANCELLED status; only the claim is released.
     */
    public boolean markCompleted(ClaimedJob claim, boolean failed, String lastError) {
        Update update = release()
                .set("status", JobStatus.COMPLETED)
                .set("failed", failed);
        if (lastError != null) {
            update.set("lastError", lastError).set("lastErrorAt", clock.instant());
        }
        Query query = claimQuery(claim).addCriteria(
                Criteria.where("status").in(JobStatus.ACTIVE, JobStatus.PAUSED));
        if (mongoTemplate.updateFirst(query, update, ScheduledJobDocument.class).getModifiedCount() > 0) {
            log.info("Job {} completed{}", claim.jobId(), failed ? " (failed)" : "");
            return true;
        }
        return updateClaimed(claim, release(), "release");
    }

    public Optional<ScheduledJobDocument> recordSuccess(ClaimedJob claim, Instant ranAt) {
        Update update = new Update()
                .inc("runCount", 1)
                .set("lastRunAt", ranAt)
                .set("consecutiveFailures", 0)
                .set("updatedAt", clock.instant())
                .inc("version", 1);
        return recordRun(claim, update);
    }

    /** Records a failed run; the returned snapshot carries the new consecutive-failure count. */
    public Optional<ScheduledJobDocument> recordFailure(ClaimedJob claim, Instant ranAt, String error) {
        Update update = new Update()
                .inc("runCount", 1)
                .set("lastRunAt", ranAt)
                .inc("failureCount", 1)
                .inc("consecutiveFailures", 1)
                .set("lastError", error)
                .set("lastErrorAt", clock.instant())
                .set("updatedAt", clock.instant())
                .inc("version", 1);
        return recordRun(claim, update);
    }

    public boolean cancelByEngine(ClaimedJob claim, String reason) {
        Update update = release()
                .set("status", JobStatus.CANCELLED)
                .set("cancelReason", reason);
        Query query = claimQuery(claim).addCriteria(
                Criteria.where("status").in(JobStatus.ACTIVE, JobStatus.PAUSED));
        if (mongoTemplate.updateFirst(query, update, ScheduledJobDocument.class).getModifiedCount() > 0) {
            log.warn("Job {} cancelled by engine: {}", claim.jobId(), reason);
            return true;
        }
        return updateClaimed(claim, release(), "release");
    }

    /** Pauses an active job after repeated failures. nextRunAt still advances. */
    public boolean pauseByEngine(ClaimedJob claim, Instant nextRunAt, String reason) {
        Update update = release()
                .set("nextRunAt", nextRunAt)
                .set("status", JobStatus.PAUSED)
                .set("lastError", reason)
                .set("lastErrorAt", clock.instant());
        Query query = claimQuery(claim).addCriteria(Criteria.where("status").is(JobStatus.ACTIVE));
        if (mongoTemplate.updateFirst(query, update, ScheduledJobDocument.class).getModifiedCount() > 0) {
            log.warn("Job {} paused by engine: {}", claim.jobId(), reason);
            return true;
        }
        return reschedule(claim, nextRunAt);
    }

    private Optional<ScheduledJobDocument> recordRun(ClaimedJob claim, Update update) {
        return Optional.ofNullable(mongoTemplate.findAndModify(claimQuery(claim), update,
                FindAndModifyOptions.options().returnNew(true), ScheduledJobDocument.class));
    }

    private boolean updateClaimed(ClaimedJob claim, Update update, String operation) {
        long modified = mongoTemplate.updateFirst(claimQuery(claim), update, ScheduledJobDocument.class)
                .getModifiedCount();
        if (modified == 0) {
            log.warn("Lost claim on job {} before {}; leaving newer state in place", claim.jobId(), operation);
            return false;
        }
        return true;
    }

    private Query claimQuery(ClaimedJob claim) {
        return new Query(Criteria.where("_id").is(claim.jobId())
                .and("claimToken").is(claim.claimToken()));
    }

    private Update release() {
        return new Update()
                .unset("claimedBy")
                .unset("claimToken")
                .unset("claimedUntil")
                .set("updatedAt", clock.instant())
                .inc("version", 1);
    }
}
