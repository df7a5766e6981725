package io.cronagent.internal;

import io.cronagent.core.Job;
import io.cronagent.core.RunTrigger;
import io.cronagent.core.SchedulerSettings;
import io.cronagent.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The control loop: sleeps until the earliest pending fire or a command, then hands every due job
 * to the {@link JobExecutor}. Never waits on a job's execution.
 *
 * <p>The queue is only a wake-up index. Each popped entry is checked against the store before it
 * runs, so a job that was disabled, deleted or rescheduled since it was queued is never fired from
 * a stale entry. The queue is also rebuilt from the store at start and every
 * {@link SchedulerSettings#resyncEvery()}.
 */
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final JobStore jobStore;
    private final JobExecutor executor;
    private final Clock clock;
    private final SchedulerSettings settings;

    private final DispatchQueue queue = new DispatchQueue();
    private final Semaphore wakeSignal = new Semaphore(0);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile Thread loopThread;
    private int systemErrorCount = 0;

    public SchedulerLoop(JobStore jobStore, JobExecutor executor, Clock clock, SchedulerSettings settings) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Load armed jobs from the store and start the loop thread. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        resync();
        Thread t = new Thread(this::loop);
        t.setName("cron.scheduler");
        t.setDaemon(true);
        loopThread = t;
        t.start();
    }

    /**
     * Stop dispatching. Runs already handed to the executor are not affected. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        Thread t = loopThread;
        loopThread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(settings.shutdownTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        queue.clear();
        wakeSignal.drainPermits();
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Re-read a job from the store, mirror its nextRunAt into the queue and wake the loop.
     *
     * <p>Serialized with {@link #forget} and resync, so a read that lost a race to a newer write
     * is never applied after it.
     */
    public synchronized void refresh(String jobId) {
        Optional<Job> job;
        try {
            job = jobStore.find(jobId);
        } catch (RuntimeException e) {
            log.warn("cron loop refresh failed, waiting for resync id={} msg={}", jobId, e.getMessage());
            wake();
            return;
        }
        if (job.isPresent() && job.get().isArmed()) {
            queue.upsert(jobId, job.get().nextRunAt());
        } else {
            queue.remove(jobId);
        }
        wake();
    }

    public synchronized void forget(String jobId) {
        queue.remove(jobId);
        wake();
    }

    public void wake() {
        wakeSignal.release();
    }

    DispatchQueue queue() {
        return queue;
    }

    private void loop() {
        Instant nextResync = clock.instant().plus(settings.resyncEvery());
        while (started.get()) {
            try {
                Instant now = clock.instant();
                if (!now.isBefore(nextResync)) {
                    resync();
                    nextResync = now.plus(settings.resyncEvery());
                }

                List<DispatchQueue.Entry> due = queue.popDue(now);
                if (!due.isEmpty()) {
                    log.debug("cron loop due jobs count={} now={}", due.size(), now);
                }
                for (DispatchQueue.Entry entry : due) {
                    dispatch(entry, now);
                }
                systemErrorCount = 0;

                long waitMs = millisUntilNextWake(nextResync);
                if (waitMs > 0) {
                    wakeSignal.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
                }
                wakeSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("cron loop iteration failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.debug("cron loop exited");
    }

    private void dispatch(DispatchQueue.Entry entry, Instant now) {
        Optional<Job> current = jobStore.find(entry.jobId());
        if (current.isEmpty()) {
            log.debug("cron loop dropped entry for deleted job id={}", entry.jobId());
            return;
        }

        Job job = current.get();
        if (!job.isArmed()) {
            return;
        }
        if (job.nextRunAt().isAfter(now)) {
            queue.upsert(job.id(), job.nextRunAt());
            return;
        }

        log.debug("cron job due id={} name={} nextRunAt={}", job.id(), job.name(), job.nextRunAt());
        executor.submit(job, RunTrigger.SCHEDULED, job.nextRunAt());
    }

    private synchronized void resync() {
        List<Job> jobs = jobStore.list();
        queue.clear();
        int armed = 0;
        for (Job job : jobs) {
            if (job.isArmed() && !executor.isRunning(job.id())) {
                queue.upsert(job.id(), job.nextRunAt());
                armed++;
            }
        }
        log.debug("cron loop resynced jobs={} armed={}", jobs.size(), armed);
    }

    private long millisUntilNextWake(Instant nextResync) {
        Instant wakeAt = queue.peekEarliest()
                .map(DispatchQueue.Entry::dueAt)
                .filter(due -> due.isBefore(nextResync))
                .orElse(nextResync);
        return Duration.between(clock.instant(), wakeAt).toMillis();
    }

    // Exponential backoff for repeated loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 6));
        long ms = Math.min(100L * (1L << exp), 10_000L);
        return Duration.ofMillis(ms);
    }
}
