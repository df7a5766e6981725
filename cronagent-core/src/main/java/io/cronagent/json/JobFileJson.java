package io.cronagent.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Top-level document of the JSON file store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobFileJson(int version, List<JobJson> jobs) {

    public static final int CURRENT_VERSION = 1;

    public JobFileJson {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static JobFileJson of(List<JobJson> jobs) {
        return new JobFileJson(CURRENT_VERSION, jobs);
    }
}
