package io.cronagent.internal;

import io.cronagent.ActionRuntime;
import io.cronagent.core.ActionResult;
import io.cronagent.core.Job;
import io.cronagent.core.JobDraft;
import io.cronagent.core.RunOutcome;
import io.cronagent.core.RunStatus;
import io.cronagent.core.RunTrigger;
import io.cronagent.core.SchedulerSettings;
import io.cronagent.store.InMemoryJobRepository;
import io.cronagent.store.JobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class JobExecutorTest {

    private final JobStore store = new JobStore(new InMemoryJobRepository(), Clock.systemUTC());
    private final JobExecutor.RunListener listener = mock(JobExecutor.RunListener.class);

    private JobExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void successfulRunShouldBeRecorded() {
        Job job = store.create(draft(false));
        executor = start(payload -> ActionResult.success(), SchedulerSettings.defaults());

        RunOutcome outcome = executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.OK);
        Job after = store.get(job.id());
        assertThat(after.state().lastStatus()).isEqualTo(RunStatus.OK);
        assertThat(after.nextRunAt()).isAfter(job.nextRunAt());
        verify(listener).onRunRecorded(eq(job.id()), argThat(Optional::isPresent));
    }

    @Test
    void thrownExceptionShouldBeRecordedAsError() {
        Job job = store.create(draft(false));
        executor = start(payload -> {
            throw new IllegalStateException("agent unavailable");
        }, SchedulerSettings.defaults());

        RunOutcome outcome = executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.ERROR);
        assertThat(store.get(job.id()).state().lastError()).isEqualTo("agent unavailable");
        assertThat(store.get(job.id()).isArmed()).isTrue();
    }

    @Test
    void longErrorShouldBeTruncated() {
        Job job = store.create(draft(false));
        executor = start(payload -> ActionResult.failure("x".repeat(100)),
                SchedulerSettings.defaults().withMaxErrorLength(16));

        executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        String error = store.get(job.id()).state().lastError();
        assertThat(error).hasSize(16).endsWith("...");
    }

    @Test
    void slowRuntimeShouldTimeOut() {
        Job job = store.create(draft(false));
        executor = start(payload -> {
            Thread.sleep(10_000);
            return ActionResult.success();
        }, SchedulerSettings.defaults().withMaxRunDuration(Duration.ofMillis(100)));

        RunOutcome outcome = executor.run(job, RunTrigger.MANUAL, job.nextRunAt());

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.ERROR);
        assertThat(store.get(job.id()).state().lastError()).startsWith("timed out after");
    }

    @Test
    void secondRunOfSameJobShouldBeSkippedWhileFirstIsInFlight() throws Exception {
        Job job = store.create(draft(false));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        executor = start(payload -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return ActionResult.success();
        }, SchedulerSettings.defaults());

        CompletableFuture<RunOutcome> first = executor.submit(job, RunTrigger.SCHEDULED, job.nextRunAt());
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(executor.isRunning(job.id())).isTrue();

        CompletableFuture<RunOutcome> second = executor.submit(job, RunTrigger.MANUAL, job.nextRunAt());
        assertThat(second).isCompleted();
        assertThat(second.get().isSkipped()).isTrue();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(RunOutcome.Status.OK);
        assertThat(executor.isRunning(job.id())).isFalse();
    }

    @Test
    void deleteAfterRunShouldNotifyListenerWithEmptyJob() {
        Job job = store.create(draft(true));
        executor = start(payload -> ActionResult.success(), SchedulerSettings.defaults());

        executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(store.find(job.id())).isEmpty();
        verify(listener).onRunRecorded(eq(job.id()), argThat(Optional::isEmpty));
    }

    @Test
    void failingRunShouldStillDeleteJobMarkedDeleteAfterRun() {
        Job job = store.create(draft(true));
        executor = start(payload -> {
            throw new IllegalStateException("agent unavailable");
        }, SchedulerSettings.defaults());

        RunOutcome outcome = executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.ERROR);
        assertThat(store.find(job.id())).isEmpty();
        verify(listener).onRunRecorded(eq(job.id()), argThat(Optional::isEmpty));
    }

    @Test
    void returnedFailureShouldStillDeleteJobMarkedDeleteAfterRun() {
        Job job = store.create(draft(true));
        executor = start(payload -> ActionResult.failure("quota exceeded"), SchedulerSettings.defaults());

        executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(store.find(job.id())).isEmpty();
        verify(listener).onRunRecorded(eq(job.id()), argThat(Optional::isEmpty));
    }

    @Test
    void scheduledRunShouldBeDroppedWhenAnotherRunMovedItsFireTime() {
        AtomicInteger calls = new AtomicInteger();
        Job job = store.create(draft(false));
        Instant intended = job.nextRunAt();
        executor = start(payload -> {
            calls.incrementAndGet();
            return ActionResult.success();
        }, SchedulerSettings.defaults());

        executor.run(job, RunTrigger.MANUAL, Instant.now());
        Instant afterManual = store.get(job.id()).nextRunAt();
        assertThat(afterManual).isNotEqualTo(intended);

        RunOutcome outcome = executor.run(job, RunTrigger.SCHEDULED, intended);

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(store.get(job.id()).nextRunAt()).isEqualTo(afterManual);
        assertThat(executor.isRunning(job.id())).isFalse();
    }

    @Test
    void scheduledRunOfDisabledJobShouldBeDropped() {
        AtomicInteger calls = new AtomicInteger();
        Job job = store.create(draft(false));
        store.setEnabled(job.id(), false);
        executor = start(payload -> {
            calls.incrementAndGet();
            return ActionResult.success();
        }, SchedulerSettings.defaults());

        RunOutcome outcome = executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(calls.get()).isZero();
        assertThat(store.get(job.id()).state().lastRunAt()).isNull();
    }

    @Test
    void jobDeletedDuringRunShouldDropResult() {
        Job job = store.create(draft(false));
        executor = start(payload -> {
            store.delete(job.id());
            return ActionResult.success();
        }, SchedulerSettings.defaults());

        RunOutcome outcome = executor.run(job, RunTrigger.SCHEDULED, job.nextRunAt());

        assertThat(outcome.status()).isEqualTo(RunOutcome.Status.OK);
        assertThat(store.find(job.id())).isEmpty();
        verify(listener).onRunRecorded(eq(job.id()), argThat(Optional::isEmpty));
    }

    private JobExecutor start(ActionRuntime runtime, SchedulerSettings settings) {
        JobExecutor started = new JobExecutor(store, runtime, settings.withShutdownTimeout(Duration.ofSeconds(2)), listener);
        started.start();
        return started;
    }

    private static JobDraft draft(boolean deleteAfterRun) {
        return JobDraft.builder()
                .name("executor-test")
                .every(Duration.ofHours(1))
                .message("run")
                .deleteAfterRun(deleteAfterRun)
                .build();
    }
}
