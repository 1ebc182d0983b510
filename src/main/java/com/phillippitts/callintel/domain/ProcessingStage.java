package com.phillippitts.callintel.domain;

/**
 * The two independently tracked stages of call processing. Each maps to a fixed group of
 * columns on the call record ({@code <prefix>_status}, {@code <prefix>_error},
 * {@code <prefix>_started_at}, {@code <prefix>_completed_at}, {@code <prefix>_updated_at}).
 */
public enum ProcessingStage {
    TRANSCRIPT("transcript"),
    LEAD_EXTRACTION("lead_extraction");

    private final String columnPrefix;

    ProcessingStage(String columnPrefix) {
        this.columnPrefix = columnPrefix;
    }

    public String columnPrefix() {
        return columnPrefix;
    }

    public String statusColumn() {
        return columnPrefix + "_status";
    }

    public String errorColumn() {
        return columnPrefix + "_error";
    }

    public String startedAtColumn() {
        return columnPrefix + "_started_at";
    }

    public String completedAtColumn() {
        return columnPrefix + "_completed_at";
    }

    public String updatedAtColumn() {
        return columnPrefix + "_updated_at";
    }
}
