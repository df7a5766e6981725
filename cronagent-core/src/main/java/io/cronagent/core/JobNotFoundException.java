package io.cronagent.core;

public class JobNotFoundException extends CronJobException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Cron job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
