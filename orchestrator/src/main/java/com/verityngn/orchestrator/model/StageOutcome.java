package com.verityngn.orchestrator.model;

/**
 * Final outcome of one pipeline stage, recorded once in its {@link StageResult}.
 */
public enum StageOutcome {
    SUCCEEDED,
    SKIPPED,   // optional stage whose fallback chain was exhausted
    FAILED
}
