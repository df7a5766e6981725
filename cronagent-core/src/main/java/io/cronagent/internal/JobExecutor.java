package io.cronagent.internal;

import io.cronagent.ActionRuntime;
import io.cronagent.core.ActionResult;
import io.cronagent.core.Job;
import io.cronagent.core.JobNotFoundException;
import io.cronagent.core.RunOutcome;
import io.cronagent.core.RunRecord;
import io.cronagent.core.RunStatus;
import io.cronagent.core.RunTrigger;
import io.cronagent.core.SchedulerSettings;
import io.cronagent.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs jobs against the {@link ActionRuntime} and writes the outcome back to the {@link JobStore}.
 *
 * <p>At most one run per job id is in flight: a run that finds the job's lock taken is reported as
 * {@link RunOutcome.Status#SKIPPED} and never queued. A scheduled run whose fire time was consumed
 * by another run before the lock was taken is dropped the same way. Runtime failures, thrown or
 * returned, and timeouts are recorded as error runs and never propagate.
 */
public class JobExecutor {

    /**
     * Notified after a run has been recorded (and its lock released).
     */
    @FunctionalInterface
    public interface RunListener {
        /**
         * @param jobId job that ran
         * @param job   job as stored after the run, or empty if it no longer exists
         */
        void onRunRecorded(String jobId, Optional<Job> job);
    }

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore jobStore;
    private final ActionRuntime runtime;
    private final SchedulerSettings settings;
    private final RunListener listener;

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    private volatile ExecutorService workerPool;
    private volatile ExecutorService runtimeCalls;

    public JobExecutor(JobStore jobStore, ActionRuntime runtime, SchedulerSettings settings, RunListener listener) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.listener = listener != null ? listener : (id, job) -> { };
    }

    public synchronized void start() {
        if (workerPool != null) {
            return;
        }
        workerPool = Executors.newFixedThreadPool(settings.workerThreads(), namedDaemon("cron.worker"));
        runtimeCalls = Executors.newCachedThreadPool(namedDaemon("cron.runtime"));
    }

    /**
     * Stop accepting runs and wait up to the shutdown timeout for in-flight ones.
     */
    public synchronized void shutdown() {
        ExecutorService pool = workerPool;
        if (pool == null) {
            return;
        }
        workerPool = null;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("cron executor shutdown timed out, interrupting running jobs={}", running);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        } finally {
            ExecutorService calls = runtimeCalls;
            runtimeCalls = null;
            if (calls != null) {
                calls.shutdownNow();
            }
        }
    }

    public boolean isRunning(String jobId) {
        return running.contains(jobId);
    }

    /**
     * Hand a job to the worker pool.
     *
     * @param intendedFireTime the fire time this run stands for; the next occurrence is computed from it
     * @return completes with the run's outcome; already complete with SKIPPED if the job is running
     * @throws IllegalStateException if the executor is not started
     */
    public CompletableFuture<RunOutcome> submit(Job job, RunTrigger trigger, Instant intendedFireTime) {
        Objects.requireNonNull(job, "job must not be null");
        ExecutorService pool = workerPool;
        if (pool == null) {
            throw new IllegalStateException("cron executor is not started");
        }
        if (!running.add(job.id())) {
            log.info("cron job run skipped, already running id={} trigger={}", job.id(), trigger);
            return CompletableFuture.completedFuture(RunOutcome.skipped(job.id()));
        }

        CompletableFuture<RunOutcome> result = new CompletableFuture<>();
        try {
            pool.execute(() -> result.complete(runLocked(job, trigger, intendedFireTime)));
        } catch (RejectedExecutionException e) {
            running.remove(job.id());
            log.warn("cron job run rejected, executor shutting down id={}", job.id());
            result.complete(RunOutcome.skipped(job.id()));
        }
        return result;
    }

    /**
     * Run a job on the calling thread, honouring the same per-job lock as {@link #submit}.
     */
    public RunOutcome run(Job job, RunTrigger trigger, Instant intendedFireTime) {
        Objects.requireNonNull(job, "job must not be null");
        if (runtimeCalls == null) {
            throw new IllegalStateException("cron executor is not started");
        }
        if (!running.add(job.id())) {
            log.info("cron job run skipped, already running id={} trigger={}", job.id(), trigger);
            return RunOutcome.skipped(job.id());
        }
        return runLocked(job, trigger, intendedFireTime);
    }

    // Caller holds the job's lock; released here.
    private RunOutcome runLocked(Job submitted, RunTrigger trigger, Instant intendedFireTime) {
        String id = submitted.id();
        RunOutcome outcome;
        Optional<Job> after = Optional.empty();
        try {
            Optional<Job> current = reread(submitted);
            if (trigger == RunTrigger.SCHEDULED && !isStillDue(current, intendedFireTime)) {
                log.debug("cron job run dropped, no longer due id={} intendedAt={}", id, intendedFireTime);
                outcome = RunOutcome.skipped(id);
                after = current;
            } else {
                Job job = current.orElse(submitted);
                outcome = execute(job, trigger, intendedFireTime);
                after = writeBack(id, outcome, intendedFireTime);
            }
        } finally {
            running.remove(id);
        }

        try {
            listener.onRunRecorded(id, after);
        } catch (RuntimeException e) {
            log.error("cron run listener failed id={} msg={}", id, e.getMessage(), e);
        }
        return outcome;
    }

    private Optional<Job> reread(Job submitted) {
        try {
            return jobStore.find(submitted.id());
        } catch (RuntimeException e) {
            log.warn("cron job re-read failed, running submitted copy id={} msg={}", submitted.id(), e.getMessage());
            return Optional.of(submitted);
        }
    }

    private RunOutcome execute(Job job, RunTrigger trigger, Instant intendedFireTime) {
        log.debug("cron job started id={} name={} trigger={} intendedAt={}", job.id(), job.name(), trigger, intendedFireTime);
        RunOutcome outcome = invokeRuntime(job);
        if (outcome.status() == RunOutcome.Status.OK) {
            log.debug("cron job succeeded id={} name={}", job.id(), job.name());
        } else {
            log.warn("cron job failed id={} name={} error={}", job.id(), job.name(), outcome.error());
        }
        return outcome;
    }

    private Optional<Job> writeBack(String id, RunOutcome outcome, Instant intendedFireTime) {
        RunRecord record = outcome.status() == RunOutcome.Status.OK
                ? RunRecord.ok(intendedFireTime)
                : new RunRecord(RunStatus.ERROR, outcome.error(), intendedFireTime);
        try {
            return jobStore.recordRun(id, record);
        } catch (JobNotFoundException e) {
            log.debug("cron job deleted while running, result dropped id={}", id);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("cron job result write-back failed id={} msg={}", id, e.getMessage(), e);
            return jobStore.find(id);
        }
    }

    // A scheduled run stands for one fire time; a run in between may already have moved it.
    private static boolean isStillDue(Optional<Job> current, Instant intendedFireTime) {
        return current.isPresent()
                && current.get().isArmed()
                && current.get().nextRunAt().equals(intendedFireTime);
    }

    private RunOutcome invokeRuntime(Job job) {
        ExecutorService calls = runtimeCalls;
        if (calls == null) {
            return RunOutcome.error(job.id(), "executor is shutting down");
        }
        Future<ActionResult> call;
        try {
            call = calls.submit(() -> runtime.execute(job.payload()));
        } catch (RejectedExecutionException e) {
            return RunOutcome.error(job.id(), "executor is shutting down");
        }

        try {
            ActionResult result = call.get(settings.maxRunDuration().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return RunOutcome.error(job.id(), "action runtime returned no result");
            }
            if (result.ok()) {
                return RunOutcome.ok(job.id());
            }
            String error = result.error() == null || result.error().isBlank() ? "action failed" : result.error();
            return RunOutcome.error(job.id(), truncate(error));
        } catch (TimeoutException e) {
            call.cancel(true);
            return RunOutcome.error(job.id(), "timed out after " + settings.maxRunDuration());
        } catch (ExecutionException e) {
            return RunOutcome.error(job.id(), truncate(describe(e.getCause() != null ? e.getCause() : e)));
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return RunOutcome.error(job.id(), "interrupted");
        }
    }

    private String truncate(String error) {
        int max = settings.maxErrorLength();
        if (error.length() <= max) {
            return error;
        }
        return error.substring(0, max - 3) + "...";
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getName() : message;
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
