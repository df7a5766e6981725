package io.cronagent.core;

/**
 * Partial update of a job's editable fields. A null component leaves the current value unchanged.
 */
public record JobPatch(
        String name,
        Boolean enabled,
        Schedule schedule,
        JobPayload payload,
        Boolean deleteAfterRun
) {

    public static JobPatch name(String name) {
        return new JobPatch(name, null, null, null, null);
    }

    public static JobPatch enabled(boolean enabled) {
        return new JobPatch(null, enabled, null, null, null);
    }

    public static JobPatch schedule(Schedule schedule) {
        if (schedule == null) {
            throw new InvalidScheduleException("schedule is required");
        }
        return new JobPatch(null, null, schedule, null, null);
    }

    public static JobPatch payload(JobPayload payload) {
        if (payload == null) {
            throw new InvalidPayloadException("payload is required");
        }
        return new JobPatch(null, null, null, payload, null);
    }

    public static JobPatch deleteAfterRun(boolean deleteAfterRun) {
        return new JobPatch(null, null, null, null, deleteAfterRun);
    }

    /**
     * Full replacement of every editable field, as submitted by an edit form.
     */
    public static JobPatch replaceWith(JobDraft draft) {
        return new JobPatch(draft.name(), draft.enabled(), draft.schedule(), draft.payload(), draft.deleteAfterRun());
    }

    public boolean isEmpty() {
        return name == null && enabled == null && schedule == null && payload == null && deleteAfterRun == null;
    }
}
