package io.cronagent.internal;

import io.cronagent.ActionRuntime;
import io.cronagent.CronService;
import io.cronagent.core.Job;
import io.cronagent.core.JobDisabledException;
import io.cronagent.core.JobDraft;
import io.cronagent.core.JobPatch;
import io.cronagent.core.JobPayload;
import io.cronagent.core.JobPhase;
import io.cronagent.core.RunOutcome;
import io.cronagent.core.RunTrigger;
import io.cronagent.core.Schedule;
import io.cronagent.core.SchedulerSettings;
import io.cronagent.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link CronService} over a {@link JobStore}: commands go to the store, and the resulting
 * nextRunAt is mirrored into the scheduler loop's queue.
 */
public class DefaultCronService implements CronService {

    private static final Logger log = LoggerFactory.getLogger(DefaultCronService.class);

    private final JobStore jobStore;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final JobExecutor executor;
    private final SchedulerLoop loop;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultCronService(JobStore jobStore, ActionRuntime runtime, SchedulerSettings settings, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = new JobExecutor(jobStore, runtime, settings, this::onRunRecorded);
        this.loop = new SchedulerLoop(jobStore, executor, clock, settings);
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("cron service starting workerThreads={}, maxRunDuration={}, resyncEvery={}",
                settings.workerThreads(), settings.maxRunDuration(), settings.resyncEvery());
        executor.start();
        loop.start();
        log.info("cron service started jobs={}", jobStore.list().size());
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("cron service stopping...");
        loop.stop();
        executor.shutdown();
        log.info("cron service stopped.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public List<Job> list() {
        return jobStore.list();
    }

    @Override
    public Job get(String id) {
        return jobStore.get(id);
    }

    @Override
    public Job create(JobDraft draft) {
        return reflect(jobStore.create(draft));
    }

    @Override
    public Job update(String id, JobPatch patch) {
        return reflect(jobStore.update(id, patch));
    }

    @Override
    public Job rename(String id, String name) {
        return reflect(jobStore.rename(id, name));
    }

    @Override
    public Job reschedule(String id, Schedule schedule) {
        return reflect(jobStore.reschedule(id, schedule));
    }

    @Override
    public Job replacePayload(String id, JobPayload payload) {
        return reflect(jobStore.replacePayload(id, payload));
    }

    @Override
    public Job setDeleteAfterRun(String id, boolean deleteAfterRun) {
        return reflect(jobStore.setDeleteAfterRun(id, deleteAfterRun));
    }

    @Override
    public Job setEnabled(String id, boolean enabled) {
        return reflect(jobStore.setEnabled(id, enabled));
    }

    @Override
    public boolean delete(String id) {
        boolean removed = jobStore.delete(id);
        if (id != null) {
            loop.forget(id);
        }
        return removed;
    }

    @Override
    public CompletableFuture<RunOutcome> runNow(String id) {
        if (!started.get()) {
            throw new IllegalStateException("cron service is not running");
        }
        Job job = jobStore.get(id);
        if (!job.enabled()) {
            throw new JobDisabledException(id);
        }
        log.info("cron job test run requested id={} name={}", id, job.name());
        return executor.submit(job, RunTrigger.MANUAL, clock.instant());
    }

    @Override
    public JobPhase phaseOf(String id) {
        Optional<Job> job = jobStore.find(id);
        if (job.isEmpty()) {
            return JobPhase.DELETED;
        }
        if (executor.isRunning(id)) {
            return JobPhase.RUNNING;
        }
        return job.get().isArmed() ? JobPhase.ARMED : JobPhase.IDLE;
    }

    private Job reflect(Job job) {
        loop.refresh(job.id());
        return job;
    }

    // The recorded copy may already be older than a concurrent command's write; the loop re-reads.
    private void onRunRecorded(String jobId, Optional<Job> job) {
        loop.refresh(jobId);
    }
}
