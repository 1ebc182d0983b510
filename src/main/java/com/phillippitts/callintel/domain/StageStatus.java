package com.phillippitts.callintel.domain;

import java.util.Locale;

/**
 * Processing status of one pipeline stage on a call record.
 *
 * <p>Transitions: {@code NONE|FAILED -> PROCESSING -> COMPLETED|FAILED}.
 */
public enum StageStatus {
    NONE("none"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    StageStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Maps a stored column value; NULL and blank are treated as {@link #NONE}.
     */
    public static StageStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (StageStatus status : values()) {
            if (status.dbValue.equals(v)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown stage status: " + value);
    }
}
