package io.cronagent.core;

/**
 * A schedule definition is malformed: bad cron expression, unknown timezone,
 * non-positive interval or a missing field for the declared kind.
 */
public class InvalidScheduleException extends CronJobException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
