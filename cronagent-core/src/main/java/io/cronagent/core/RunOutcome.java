package io.cronagent.core;

/**
 * Result of one execution attempt as seen by the executor.
 */
public record RunOutcome(String jobId, Status status, String error) {

    public enum Status {
        OK,
        ERROR,
        /** Another run of the same job held the lock; nothing was executed or recorded. */
        SKIPPED
    }

    public static RunOutcome ok(String jobId) {
        return new RunOutcome(jobId, Status.OK, null);
    }

    public static RunOutcome error(String jobId, String error) {
        return new RunOutcome(jobId, Status.ERROR, error);
    }

    public static RunOutcome skipped(String jobId) {
        return new RunOutcome(jobId, Status.SKIPPED, null);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
