package io.cronagent.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Error body: {@code {code, message, path}}.
 */
public record ErrorResponse(String code, String message, String path) {

    public static ErrorResponse of(CronErrorCode errorCode, String detail, HttpServletRequest request) {
        String message = detail == null || detail.isBlank() ? errorCode.getMessage() : detail;
        return new ErrorResponse(errorCode.getCode(), message, request.getRequestURI());
    }
}
