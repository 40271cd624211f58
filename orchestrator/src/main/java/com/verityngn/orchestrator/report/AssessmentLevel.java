package com.verityngn.orchestrator.report;

/** Overall assessment of a video across all of its claims. */
public enum AssessmentLevel {
    LIKELY_TRUE,
    MIXED,
    LIKELY_FALSE,
    UNABLE_TO_DETERMINE
}
