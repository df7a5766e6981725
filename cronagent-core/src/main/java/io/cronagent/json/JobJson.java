package io.cronagent.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.cronagent.core.InvalidPayloadException;
import io.cronagent.core.InvalidScheduleException;
import io.cronagent.core.Job;
import io.cronagent.core.JobDraft;
import io.cronagent.core.JobPatch;
import io.cronagent.core.JobState;

/**
 * Wire form of a job, shared by the REST API and the JSON file store. Timestamps are epoch
 * milliseconds; absent values are omitted.
 *
 * <p>On input every field is optional: {@link #toDraft()} applies creation defaults and
 * {@link #toPatch()} leaves absent fields untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobJson(
        String id,
        String name,
        Boolean enabled,
        ScheduleJson schedule,
        PayloadJson payload,
        StateJson state,
        Long createdAtMs,
        Long updatedAtMs,
        Boolean deleteAfterRun
) {

    public static JobJson from(Job job) {
        return new JobJson(
                job.id(),
                job.name(),
                job.enabled(),
                ScheduleJson.from(job.schedule()),
                PayloadJson.from(job.payload()),
                StateJson.from(job.state()),
                job.createdAt().toEpochMilli(),
                job.updatedAt().toEpochMilli(),
                job.deleteAfterRun()
        );
    }

    /**
     * Restores a stored job, including its id, run state and timestamps.
     */
    public Job toJob() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("stored job has no id");
        }
        if (createdAtMs == null) {
            throw new IllegalArgumentException("stored job " + id + " has no createdAtMs");
        }
        JobState restored = state == null ? JobState.initial(null) : state.toState();
        return new Job(
                id,
                name,
                Boolean.TRUE.equals(enabled),
                requireSchedule().toSchedule(),
                Boolean.TRUE.equals(deleteAfterRun),
                requirePayload().toPayload(),
                restored,
                StateJson.toInstant(createdAtMs),
                StateJson.toInstant(updatedAtMs != null ? updatedAtMs : createdAtMs)
        );
    }

    /**
     * Definition of a new job. {@code enabled} defaults to true, {@code deleteAfterRun} to false.
     */
    public JobDraft toDraft() {
        return JobDraft.builder()
                .name(name)
                .enabled(enabled == null || enabled)
                .schedule(requireSchedule().toSchedule())
                .payload(requirePayload().toPayload())
                .deleteAfterRun(Boolean.TRUE.equals(deleteAfterRun))
                .build();
    }

    /**
     * Partial update; only fields present in the request change.
     */
    public JobPatch toPatch() {
        return new JobPatch(
                name,
                enabled,
                schedule == null ? null : schedule.toSchedule(),
                payload == null ? null : payload.toPayload(),
                deleteAfterRun
        );
    }

    private ScheduleJson requireSchedule() {
        if (schedule == null) {
            throw new InvalidScheduleException("schedule is required");
        }
        return schedule;
    }

    private PayloadJson requirePayload() {
        if (payload == null) {
            throw new InvalidPayloadException("payload is required");
        }
        return payload;
    }
}
