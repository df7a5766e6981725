package io.cronagent;

import io.cronagent.core.Job;
import io.cronagent.core.JobDraft;
import io.cronagent.core.JobPatch;
import io.cronagent.core.JobPayload;
import io.cronagent.core.JobPhase;
import io.cronagent.core.RunOutcome;
import io.cronagent.core.Schedule;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main scheduler API: manages jobs and runs them when they come due.
 *
 * <p>Supports three schedule styles:
 * <ul>
 *   <li>One-shot at an absolute instant</li>
 *   <li>Fixed interval</li>
 *   <li>5-field cron expression in a timezone</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * cronService.start();
 *
 * Job job = cronService.create(JobDraft.builder()
 *         .name("morning digest")
 *         .cron("0 8 * * 1-5", "Europe/Berlin")
 *         .payload(JobPayload.delivered("Summarize my inbox", "telegram", "42"))
 *         .build());
 *
 * cronService.runNow(job.id());
 * cronService.stop();
 * }</pre>
 *
 * <p>Commands that change a job take effect on the dispatch schedule immediately. All methods may be
 * called from any thread.
 */
public interface CronService {

    void start();

    void stop();

    boolean isRunning();

    /**
     * All jobs, oldest first.
     */
    List<Job> list();

    /**
     * @throws io.cronagent.core.JobNotFoundException if no job has this id
     */
    Job get(String id);

    /**
     * @throws io.cronagent.core.InvalidScheduleException on a malformed schedule
     * @throws io.cronagent.core.InvalidPayloadException  on a payload without message text
     */
    Job create(JobDraft draft);

    /**
     * Partial update; absent fields keep their values. A changed schedule re-arms the job from now.
     */
    Job update(String id, JobPatch patch);

    Job rename(String id, String name);

    Job reschedule(String id, Schedule schedule);

    Job replacePayload(String id, JobPayload payload);

    Job setDeleteAfterRun(String id, boolean deleteAfterRun);

    /**
     * Idempotent.
     */
    Job setEnabled(String id, boolean enabled);

    /**
     * Idempotent: deleting an unknown id is a no-op.
     *
     * @return true if a job was removed
     */
    boolean delete(String id);

    /**
     * Run a job now, regardless of its schedule. The run happens asynchronously; its result is recorded
     * in the job state like a scheduled run. If the job is already running the returned outcome is
     * {@link RunOutcome.Status#SKIPPED}.
     *
     * @throws io.cronagent.core.JobNotFoundException if no job has this id
     * @throws io.cronagent.core.JobDisabledException if the job is disabled
     * @throws IllegalStateException                  if the service is not running
     */
    CompletableFuture<RunOutcome> runNow(String id);

    JobPhase phaseOf(String id);
}
