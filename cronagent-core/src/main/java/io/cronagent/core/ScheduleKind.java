package io.cronagent.core;

import java.util.Locale;

public enum ScheduleKind {

    AT("at") {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    EVERY("every") {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    CRON("cron") {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    private final String wireName;

    ScheduleKind(String wireName) {
        this.wireName = wireName;
    }

    public abstract boolean isRecurring();

    /**
     * Lower-case discriminant used by the JSON wire format ("at", "every", "cron").
     */
    public String wireName() {
        return wireName;
    }

    public static ScheduleKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidScheduleException("schedule.kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new InvalidScheduleException("Unsupported schedule kind: " + value);
    }
}
