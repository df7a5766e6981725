package io.cronagent.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.cronagent.core.JobState;
import io.cronagent.core.RunStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateJson(
        Long nextRunAtMs,
        Long lastRunAtMs,
        String lastStatus,
        String lastError
) {

    public static StateJson from(JobState state) {
        return new StateJson(
                toMillis(state.nextRunAt()),
                toMillis(state.lastRunAt()),
                state.lastStatus() == RunStatus.NONE ? null : state.lastStatus().wireName(),
                state.lastError()
        );
    }

    public JobState toState() {
        return new JobState(
                toInstant(nextRunAtMs),
                toInstant(lastRunAtMs),
                RunStatus.fromWireName(lastStatus),
                lastError
        );
    }

    static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    static Instant toInstant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }
}
