package io.cronagent.web;

import io.cronagent.core.InvalidPayloadException;
import io.cronagent.core.InvalidScheduleException;
import io.cronagent.core.JobDisabledException;
import io.cronagent.core.JobNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps scheduler exceptions raised by {@link CronJobController} to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice(assignableTypes = CronJobController.class)
public class CronExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CronExceptionHandler.class);

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSchedule(InvalidScheduleException e, HttpServletRequest request) {
        return respond(CronErrorCode.INVALID_SCHEDULE, e.getMessage(), request);
    }

    @ExceptionHandler(InvalidPayloadException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPayload(InvalidPayloadException e, HttpServletRequest request) {
        return respond(CronErrorCode.INVALID_PAYLOAD, e.getMessage(), request);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e, HttpServletRequest request) {
        return respond(CronErrorCode.JOB_NOT_FOUND, e.getMessage(), request);
    }

    @ExceptionHandler(JobDisabledException.class)
    public ResponseEntity<ErrorResponse> handleDisabled(JobDisabledException e, HttpServletRequest request) {
        return respond(CronErrorCode.JOB_DISABLED, e.getMessage(), request);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        return respond(CronErrorCode.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e, HttpServletRequest request) {
        log.error("cron api unhandled exception path={} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(CronErrorCode.INTERNAL_SERVER_ERROR, null, request);
    }

    private static ResponseEntity<ErrorResponse> respond(CronErrorCode errorCode, String detail,
                                                         HttpServletRequest request) {
        if (errorCode != CronErrorCode.INTERNAL_SERVER_ERROR) {
            log.debug("cron api error code={} msg={} path={} {}",
                    errorCode.getCode(), detail, request.getMethod(), request.getRequestURI());
        }
        return ResponseEntity.status(errorCode.getHttpStatus()).body(ErrorResponse.of(errorCode, detail, request));
    }
}
