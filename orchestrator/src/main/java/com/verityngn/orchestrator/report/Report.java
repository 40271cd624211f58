package com.verityngn.orchestrator.report;

import java.util.List;
import java.util.UUID;

/**
 * Final verification report. Contains nothing that varies between two
 * assemblies of the same stage results (no timestamps, no map iteration
 * order), so its canonical JSON form is byte-stable.
 *
 * @param partial       true when assembled from a FAILED job
 * @param missingStages required stages without a SUCCEEDED result (partial reports only)
 */
public record Report(
        UUID               jobId,
        boolean            partial,
        List<String>       missingStages,
        List<ClaimVerdict> claims,
        ReportSummary      summary,
        List<StageSummary> stages) {

    public Report {
        missingStages = List.copyOf(missingStages);
        claims        = List.copyOf(claims);
        stages        = List.copyOf(stages);
    }
}
