package io.cronagent.core;

public enum RunTrigger {
    /** Fired by the scheduler loop because nextRunAt came due. */
    SCHEDULED,
    /** Requested through the test-run command. */
    MANUAL
}
