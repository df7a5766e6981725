package io.cronagent.store;

import io.cronagent.core.Job;
import io.cronagent.core.JobDraft;
import io.cronagent.core.JobNotFoundException;
import io.cronagent.core.JobPatch;
import io.cronagent.core.JobPayload;
import io.cronagent.core.JobState;
import io.cronagent.core.RunRecord;
import io.cronagent.core.Schedule;
import io.cronagent.utils.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Registry of job definitions and their run state.
 *
 * <p>Every mutation is one atomic read-modify-write on the underlying {@link JobRepository} and keeps
 * {@code state.nextRunAt} consistent with the job's schedule and enabled flag:
 * <ul>
 *   <li>create / enable / schedule change: next occurrence after now</li>
 *   <li>disable: cleared</li>
 *   <li>recorded run: next occurrence after the run's intended fire time</li>
 * </ul>
 */
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobRepository repository;
    private final Clock clock;

    public JobStore(JobRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Job create(JobDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");

        Instant now = clock.instant();
        Instant nextRunAt = draft.enabled() ? ScheduleEvaluator.nextOccurrence(draft.schedule(), now) : null;
        Job job = new Job(
                UUID.randomUUID().toString(),
                draft.name(),
                draft.enabled(),
                draft.schedule(),
                draft.deleteAfterRun(),
                draft.payload(),
                JobState.initial(nextRunAt),
                now,
                now
        );
        repository.insert(job);
        log.info("cron job created id={} name={} schedule={} nextRunAt={}",
                job.id(), job.name(), job.schedule().kind(), nextRunAt);
        return job;
    }

    public Optional<Job> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository.findById(id);
    }

    /**
     * @throws JobNotFoundException if no job has this id
     */
    public Job get(String id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<Job> list() {
        return repository.findAll();
    }

    /**
     * Apply a partial update. When the schedule or the enabled flag changes, nextRunAt is recomputed
     * from now; otherwise it is kept so editing a label does not shift the schedule.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public Job update(String id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        if (patch.isEmpty()) {
            return get(id);
        }

        Job updated = mutate(id, current -> {
            Instant now = clock.instant();

            String name = patch.name() != null ? patch.name() : current.name();
            boolean enabled = patch.enabled() != null ? patch.enabled() : current.enabled();
            Schedule schedule = patch.schedule() != null ? patch.schedule() : current.schedule();
            JobPayload payload = patch.payload() != null ? patch.payload() : current.payload();
            boolean deleteAfterRun = patch.deleteAfterRun() != null ? patch.deleteAfterRun() : current.deleteAfterRun();

            boolean rearm = enabled != current.enabled() || !schedule.equals(current.schedule());
            Instant nextRunAt = current.nextRunAt();
            if (!enabled) {
                nextRunAt = null;
            } else if (rearm) {
                nextRunAt = ScheduleEvaluator.nextOccurrence(schedule, now);
            }

            return new Job(
                    current.id(),
                    name,
                    enabled,
                    schedule,
                    deleteAfterRun,
                    payload,
                    current.state().withNextRunAt(nextRunAt),
                    current.createdAt(),
                    current.touch(now)
            );
        });
        log.info("cron job updated id={} enabled={} nextRunAt={}", id, updated.enabled(), updated.nextRunAt());
        return updated;
    }

    public Job rename(String id, String name) {
        return update(id, JobPatch.name(name == null ? "" : name));
    }

    public Job reschedule(String id, Schedule schedule) {
        return update(id, JobPatch.schedule(schedule));
    }

    public Job replacePayload(String id, JobPayload payload) {
        return update(id, JobPatch.payload(payload));
    }

    public Job setDeleteAfterRun(String id, boolean deleteAfterRun) {
        return update(id, JobPatch.deleteAfterRun(deleteAfterRun));
    }

    /**
     * Enable or disable a job. Enabling computes nextRunAt from now; disabling clears it.
     * Idempotent: a job already in the requested state is returned unchanged.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public Job setEnabled(String id, boolean enabled) {
        Job result = mutate(id, current -> {
            if (current.enabled() == enabled) {
                return current;
            }
            Instant now = clock.instant();
            Instant nextRunAt = enabled ? ScheduleEvaluator.nextOccurrence(current.schedule(), now) : null;
            return current.withEnabled(enabled, nextRunAt, now);
        });
        log.info("cron job {} id={} nextRunAt={}", enabled ? "enabled" : "disabled", id, result.nextRunAt());
        return result;
    }

    /**
     * Remove a job. Deleting an unknown id is a no-op.
     *
     * @return true if a job was removed
     */
    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        boolean removed = repository.deleteById(id);
        if (removed) {
            log.info("cron job deleted id={}", id);
        } else {
            log.debug("cron job delete ignored, not found id={}", id);
        }
        return removed;
    }

    /**
     * Write back a completed run: lastRunAt, lastStatus and lastError, then either delete the job
     * (deleteAfterRun) or advance nextRunAt from the run's intended fire time.
     *
     * @return the updated job, or empty when it was deleted because of deleteAfterRun
     * @throws JobNotFoundException if the job no longer exists
     */
    public Optional<Job> recordRun(String id, RunRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        Job current = get(id);
        if (current.deleteAfterRun()) {
            if (!repository.deleteById(id)) {
                throw new JobNotFoundException(id);
            }
            log.info("cron job deleted after run id={} status={}", id, record.status().wireName());
            return Optional.empty();
        }

        Job updated = mutate(id, job -> {
            Instant now = clock.instant();
            Instant nextRunAt = job.enabled()
                    ? ScheduleEvaluator.nextRunAfterFire(job.schedule(), record.intendedFireTime(), now)
                    : null;
            JobState state = job.state().afterRun(now, record.status(), record.error(), nextRunAt);
            return job.withState(state, now);
        });
        log.debug("cron job run recorded id={} status={} nextRunAt={}",
                id, record.status().wireName(), updated.nextRunAt());
        return Optional.of(updated);
    }

    private Job mutate(String id, UnaryOperator<Job> change) {
        if (id == null) {
            throw new JobNotFoundException(null);
        }
        return repository.update(id, change).orElseThrow(() -> new JobNotFoundException(id));
    }
}
