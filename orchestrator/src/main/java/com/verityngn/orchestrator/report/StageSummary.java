package com.verityngn.orchestrator.report;

import com.verityngn.orchestrator.model.StageOutcome;

/** How one stage ended, as listed in the report. */
public record StageSummary(String stage, StageOutcome outcome, String provider, int attempts) {}
