package com.phillippitts.callintel.domain;

/**
 * What a single stage invocation did. Callers that need the durable outcome read the
 * persisted status instead; this value only drives in-process sequencing and metrics.
 */
public enum StageRunResult {
    /** The claim matched no row: another worker owns the record, or it is already done. */
    SKIPPED,
    COMPLETED,
    FAILED
}
