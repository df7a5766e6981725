package io.cronagent.core;

public class InvalidPayloadException extends CronJobException {

    public InvalidPayloadException(String message) {
        super(message);
    }
}
