package com.verityngn.orchestrator.model;

/**
 * How the executor drives a stage's provider.
 */
public enum StageKind {
    /** One call to a stage provider with the job's prior results. */
    DIRECT,
    /** Video split into time segments, analysed with bounded fan-out and checkpointed per segment. */
    SEGMENTED_ANALYSIS,
    /** One evidence query per claim taken from the input stage's payload. */
    EVIDENCE_SEARCH
}
