package io.cronagent.web;

import org.springframework.http.HttpStatus;

/**
 * Error codes returned by the cron REST API.
 */
public enum CronErrorCode {
    INVALID_SCHEDULE(HttpStatus.BAD_REQUEST, "Invalid schedule.", "CRON-001"),
    INVALID_PAYLOAD(HttpStatus.BAD_REQUEST, "Invalid payload.", "CRON-002"),
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "Cron job not found.", "CRON-003"),
    JOB_DISABLED(HttpStatus.CONFLICT, "Cron job is disabled.", "CRON-004"),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "Bad request.", "COMMON-001"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error.", "COMMON-002");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;

    CronErrorCode(HttpStatus httpStatus, String message, String code) {
        this.httpStatus = httpStatus;
        this.message = message;
        this.code = code;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getMessage() {
        return message;
    }

    public String getCode() {
        return code;
    }
}
