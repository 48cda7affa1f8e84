package io.github.drompincen.jobengine.runtime.dispatch;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.ExecutionOutcome;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import io.github.drompincen.jobengine.runtime.action.ActionHandler;
import io.github.drompincen.jobengine.runtime.action.ActionHandlerRegistry;
import io.github.drompincen.jobengine.runtime.action.ActionOutcome;
import io.github.drompincen.jobengine.runtime.action.DispatchContext;
import io.github.drompincen.jobengine.runtime.error.JobEngineException;
import io.github.drompincen.jobengine.runtime.job.ClaimedJob;
import io.github.drompincen.jobengine.runtime.job.ScheduledJobStore;
import io.github.drompincen.jobengine.runtime.schedule.RecurrenceEvaluator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Polls for due jobs, claims them and runs their action. One-shot jobs are retried within
 * the cycle and then completed; recurring jobs run once per occurrence and are rescheduled
 * whatever the outcome.
 *
 * <p>A claimed job may wait in the worker queue past its lease, so the lease is renewed
 * before every handler attempt. A job whose claim was taken over in the meantime is left to
 * the new owner without running its action.
 */
@Service
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);
    static final String MISSED_WINDOW = "missed catch-up window";
    static final int FINALIZE_ATTEMPTS = 3;

    private final ScheduledJobStore store;
    private final RecurrenceEvaluator evaluator;
    private final ActionHandlerRegistry handlers;
    private final JobExecutionRecorder recorder;
    private final DispatchPolicy policy;
    private final Clock clock;
    private final ExecutorService workerPool;
    private final ExecutorService handlerPool;

    public JobDispatcher(ScheduledJobStore store,
                         RecurrenceEvaluator evaluator,
                         ActionHandlerRegistry handlers,
                         JobExecutionRecorder recorder,
                         DispatchPolicy policy,
                         Clock clock) {
        this.store = store;
        this.evaluator = evaluator;
        this.handlers = handlers;
        this.recorder = recorder;
        this.policy = policy;
        this.clock = clock;
        this.workerPool = Executors.newFixedThreadPool(policy.workerThreads(), new CustomizableThreadFactory("dispatch-"));
        // Unbounded so a handler that ignores interruption after a timeout cannot starve the next one
        this.handlerPool = Executors.newCachedThreadPool(new CustomizableThreadFactory("handler-"));
    }

    @Scheduled(fixedDelayString = "${jobengine.dispatcher.poll-interval-ms:30000}")
    public void poll() {
        int dispatched = dispatchDue();
        if (dispatched == 0) {
            log.debug("No due jobs");
        }
    }

    /** Claims one batch of due jobs and waits until all of them are dispatched. */
    public int dispatchDue() {
        List<ClaimedJob> claimed = store.claimDue(policy.batchSize(), clock.instant());
        if (claimed.isEmpty()) return 0;

        List<Future<?>> running = new ArrayList<>(claimed.size());
        for (ClaimedJob claim : claimed) {
            running.add(workerPool.submit(() -> dispatch(claim)));
        }
        for (Future<?> future : running) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} dispatches", claimed.size());
                break;
            } catch (ExecutionException e) {
                log.error("Dispatch worker failed", e.getCause());
            }
        }
        return claimed.size();
    }

    void dispatch(ClaimedJob claim) {
        try {
            doDispatch(claim);
        } catch (RuntimeException e) {
            // Claim stays in place until its lease runs out, then the job is picked up again
            log.error("Dispatch of job {} aborted: {}", claim.jobId(), e.getMessage(), e);
        }
    }

    private void doDispatch(ClaimedJob claim) {
        ScheduledJobDocument job = claim.job();
        Instant scheduledFor = job.getNextRunAt();
        Instant startedAt = clock.instant();

        if (!store.renewClaim(claim, startedAt)) {
            return;
        }
        if (isStale(scheduledFor, startedAt)) {
            skip(claim, scheduledFor, startedAt);
            return;
        }

        ActionHandler handler = handlers.handlerFor(job.getActionType());
        boolean once = job.getScheduleType() == ScheduleType.ONCE;
        int maxAttempts = once ? Math.max(1, policy.maxAttempts()) : 1;

        Attempt result = null;
        int attempt = 1;
        for (; attempt <= maxAttempts; attempt++) {
            if (attempt > 1 && !store.renewClaim(claim, clock.instant())) {
                log.warn("Job {} abandoned before attempt {}: claim taken over", job.getJobId(), attempt);
                return;
            }
            result = invoke(handler, new DispatchContext(job, scheduledFor, attempt));
            if (result.outcome().success() || attempt == maxAttempts) break;

            Duration delay = policy.backoff(attempt);
            log.info("Job {} attempt {} failed ({}), retrying in {} ms",
                    job.getJobId(), attempt, result.outcome().error(), delay.toMillis());
            if (!sleep(delay)) break;
        }
        int attempts = Math.min(attempt, maxAttempts);
        Instant endedAt = clock.instant();

        ActionOutcome outcome = result.outcome();
        if (outcome.success()) {
            persist(claim, "recordSuccess", () -> store.recordSuccess(claim, endedAt));
        } else {
            log.warn("Job {} failed after {} attempt(s): {}", job.getJobId(), attempts, outcome.error());
        }

        if (once) {
            if (!outcome.success()) {
                persist(claim, "recordFailure", () -> store.recordFailure(claim, endedAt, outcome.error()));
            }
            persist(claim, "markCompleted", () -> store.markCompleted(claim, !outcome.success()));
        } else {
            finishRecurring(claim, outcome);
        }

        recorder.record(claim, scheduledFor, startedAt, endedAt, attempts,
                outcome.success() ? ExecutionOutcome.SUCCESS
                        : result.timedOut() ? ExecutionOutcome.TIMED_OUT : ExecutionOutcome.FAILED,
                outcome.error(), outcome.conversationId(), outcome.summary());
    }

    private void finishRecurring(ClaimedJob claim, ActionOutcome outcome) {
        ScheduledJobDocument job = claim.job();
        int consecutiveFailures = 0;
        if (!outcome.success()) {
            Optional<ScheduledJobDocument> updated = persist(claim, "recordFailure",
                    () -> store.recordFailure(claim, clock.instant(), outcome.error()));
            consecutiveFailures = updated.map(ScheduledJobDocument::getConsecutiveFailures).orElse(0);
        }

        Instant next;
        try {
            next = evaluator.nextRun(job.getCronExpression(), job.getTimezone(), clock.instant());
        } catch (JobEngineException e) {
            store.cancelByEngine(claim, "Cannot compute next run: " + e.getMessage());
            return;
        }

        int threshold = policy.pauseAfterConsecutiveFailures();
        if (threshold > 0 && consecutiveFailures >= threshold) {
            String reason = "Paused after " + consecutiveFailures + " consecutive failures: " + outcome.error();
            persist(claim, "pauseByEngine", () -> store.pauseByEngine(claim, next, reason));
        } else {
            persist(claim, "reschedule", () -> store.reschedule(claim, next));
        }
    }

    private void skip(ClaimedJob claim, Instant scheduledFor, Instant now) {
        ScheduledJobDocument job = claim.job();
        log.warn("Job {} occurrence at {} is older than the catch-up window; skipping", job.getJobId(), scheduledFor);
        String error = MISSED_WINDOW;
        if (job.getScheduleType() == ScheduleType.ONCE) {
            store.markCompleted(claim, true, MISSED_WINDOW);
        } else {
            try {
                store.reschedule(claim, evaluator.nextRun(job.getCronExpression(), job.getTimezone(), now));
            } catch (JobEngineException e) {
                error = "Cannot compute next run: " + e.getMessage();
                store.cancelByEngine(claim, error);
            }
        }
        recorder.record(claim, scheduledFor, now, clock.instant(), 0, ExecutionOutcome.SKIPPED,
                error, null, null);
    }

    /**
     * Runs a post-action store write, retrying transient data-access failures so an action
     * that already ran is not left claimed and fired again once the lease runs out.
     */
    private <T> T persist(ClaimedJob claim, String operation, Supplier<T> write) {
        for (int attempt = 1; ; attempt++) {
            try {
                return write.get();
            } catch (DataAccessException e) {
                if (attempt >= FINALIZE_ATTEMPTS) throw e;
                Duration delay = policy.backoff(attempt);
                log.warn("Job {} {} failed ({}), retrying in {} ms",
                        claim.jobId(), operation, e.getMessage(), delay.toMillis());
                if (!sleep(delay)) throw e;
            }
        }
    }

    private boolean isStale(Instant scheduledFor, Instant now) {
        Duration window = policy.catchUpWindow();
        return window != null && !window.isZero() && !window.isNegative()
                && scheduledFor != null && scheduledFor.isBefore(now.minus(window));
    }

    private Attempt invoke(ActionHandler handler, DispatchContext context) {
        Future<ActionOutcome> future = handlerPool.submit(() -> handler.execute(context));
        try {
            ActionOutcome outcome = future.get(policy.handlerTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return new Attempt(outcome != null ? outcome : ActionOutcome.failure("Handler returned no outcome"), false);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new Attempt(ActionOutcome.failure(
                    "Handler timed out after " + policy.handlerTimeout().toMillis() + " ms"), true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new Attempt(ActionOutcome.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage()), false);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new Attempt(ActionOutcome.failure("Dispatch interrupted"), false);
        }
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        workerPool.shutdown();
        handlerPool.shutdownNow();
    }

    private record Attempt(ActionOutcome outcome, boolean timedOut) {}
}
