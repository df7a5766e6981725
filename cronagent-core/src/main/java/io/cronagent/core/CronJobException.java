package io.cronagent.core;

/**
 * Base type for every error the scheduler reports to its callers.
 */
public class CronJobException extends RuntimeException {

    public CronJobException(String message) {
        super(message);
    }

    public CronJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
