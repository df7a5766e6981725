package io.cronagent.core;

/**
 * Raised when a manual run is requested for a disabled job.
 */
public class JobDisabledException extends CronJobException {

    private final String jobId;

    public JobDisabledException(String jobId) {
        super("Cron job is disabled: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
