package io.cronagent.internal;

import io.cronagent.ActionRuntime;
import io.cronagent.core.ActionResult;
import io.cronagent.core.Job;
import io.cronagent.core.JobDisabledException;
import io.cronagent.core.JobDraft;
import io.cronagent.core.JobNotFoundException;
import io.cronagent.core.JobPayload;
import io.cronagent.core.JobPhase;
import io.cronagent.core.RunOutcome;
import io.cronagent.core.RunStatus;
import io.cronagent.core.SchedulerSettings;
import io.cronagent.store.InMemoryJobRepository;
import io.cronagent.store.JobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultCronServiceTest {

    private static final SchedulerSettings SETTINGS = SchedulerSettings.defaults()
            .withWorkerThreads(2)
            .withResyncEvery(Duration.ofSeconds(1))
            .withShutdownTimeout(Duration.ofSeconds(2));

    private final JobStore store = new JobStore(new InMemoryJobRepository(), Clock.systemUTC());
    private DefaultCronService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.stop();
        }
    }

    @Test
    void intervalJobShouldFireRepeatedly() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        service = newService(payload -> {
            runs.incrementAndGet();
            return ActionResult.success();
        });
        service.start();

        Job job = service.create(JobDraft.builder()
                .name("heartbeat")
                .every(Duration.ofMillis(150))
                .message("ping")
                .build());

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() >= 3));
        Job after = service.get(job.id());
        assertEquals(RunStatus.OK, after.state().lastStatus());
        assertNotNull(after.state().lastRunAt());
        assertNotNull(after.nextRunAt());
    }

    @Test
    void oneShotWithDeleteAfterRunShouldFireOnceAndDisappear() throws Exception {
        List<String> messages = new CopyOnWriteArrayList<>();
        service = newService(payload -> {
            messages.add(payload.message());
            return ActionResult.success();
        });
        service.start();

        Job job = service.create(JobDraft.builder()
                .name("reminder")
                .at(Instant.now().plusMillis(200))
                .payload(JobPayload.delivered("drink water", "telegram", "42"))
                .deleteAfterRun(true)
                .build());

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> service.phaseOf(job.id()) == JobPhase.DELETED));
        Thread.sleep(300);
        assertEquals(List.of("drink water"), messages);
        assertTrue(service.list().isEmpty());
    }

    @Test
    void overdueJobShouldFireOnceAtStart() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        service = newService(payload -> {
            runs.incrementAndGet();
            return ActionResult.success();
        });
        Job job = service.create(JobDraft.builder()
                .at(Instant.now().plusMillis(50))
                .message("missed while down")
                .build());
        Thread.sleep(200);

        service.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() == 1));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> service.get(job.id()).isSpent()));
        Thread.sleep(300);
        assertEquals(1, runs.get());
    }

    @Test
    void disabledJobShouldNotFire() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        service = newService(payload -> {
            runs.incrementAndGet();
            return ActionResult.success();
        });
        service.start();

        Job job = service.create(JobDraft.builder()
                .every(Duration.ofMillis(200))
                .message("quiet")
                .build());
        service.setEnabled(job.id(), false);
        Thread.sleep(600);

        assertEquals(0, runs.get());
        assertEquals(JobPhase.IDLE, service.phaseOf(job.id()));
    }

    @Test
    void runNowShouldExecuteAndRecordResult() throws Exception {
        service = newService(payload -> ActionResult.failure("channel offline"));
        service.start();
        Job job = service.create(JobDraft.builder()
                .every(Duration.ofHours(1))
                .message("report")
                .build());

        RunOutcome outcome = service.runNow(job.id()).get(5, TimeUnit.SECONDS);

        assertEquals(RunOutcome.Status.ERROR, outcome.status());
        Job after = service.get(job.id());
        assertEquals(RunStatus.ERROR, after.state().lastStatus());
        assertEquals("channel offline", after.state().lastError());
        assertEquals(JobPhase.ARMED, service.phaseOf(job.id()));
    }

    @Test
    void runNowShouldRejectDisabledAndUnknownJobs() {
        service = newService(payload -> ActionResult.success());
        service.start();
        Job job = service.create(JobDraft.builder()
                .enabled(false)
                .every(Duration.ofMinutes(1))
                .message("off")
                .build());

        assertThrows(JobDisabledException.class, () -> service.runNow(job.id()));
        assertThrows(JobNotFoundException.class, () -> service.runNow("missing"));
    }

    @Test
    void runNowShouldRequireRunningService() {
        service = newService(payload -> ActionResult.success());
        Job job = service.create(JobDraft.builder().every(Duration.ofMinutes(1)).message("m").build());

        assertThrows(IllegalStateException.class, () -> service.runNow(job.id()));
    }

    @Test
    void phaseShouldTrackJobLifecycle() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        service = newService(payload -> {
            release.await(5, TimeUnit.SECONDS);
            return ActionResult.success();
        });
        service.start();
        Job job = service.create(JobDraft.builder().every(Duration.ofHours(1)).message("slow").build());
        assertEquals(JobPhase.ARMED, service.phaseOf(job.id()));

        service.runNow(job.id());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> service.phaseOf(job.id()) == JobPhase.RUNNING));

        release.countDown();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> service.phaseOf(job.id()) == JobPhase.ARMED));

        assertTrue(service.delete(job.id()));
        assertFalse(service.delete(job.id()));
        assertEquals(JobPhase.DELETED, service.phaseOf(job.id()));
    }

    @Test
    void startAndStopShouldBeIdempotent() {
        service = newService(payload -> ActionResult.success());

        service.start();
        service.start();
        assertTrue(service.isRunning());

        service.stop();
        service.stop();
        assertFalse(service.isRunning());
    }

    private DefaultCronService newService(ActionRuntime runtime) {
        return new DefaultCronService(store, runtime, SETTINGS, Clock.systemUTC());
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
