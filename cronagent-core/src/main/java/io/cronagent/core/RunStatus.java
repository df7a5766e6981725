package io.cronagent.core;

import java.util.Locale;

/**
 * Outcome recorded for a job's most recent completed run.
 */
public enum RunStatus {
    NONE,
    OK,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ok" -> OK;
            case "error" -> ERROR;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unsupported run status: " + value);
        };
    }
}
