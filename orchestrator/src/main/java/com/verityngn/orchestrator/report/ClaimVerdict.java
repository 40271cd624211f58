package com.verityngn.orchestrator.report;

import java.util.List;

/**
 * One verified claim as it appears in the report.
 *
 * @param probabilities null when the verifier only returned a label
 */
public record ClaimVerdict(
        String                  claim,
        Verdict                 verdict,
        String                  explanation,
        Probabilities           probabilities,
        List<EvidenceReference> evidence) {

    public ClaimVerdict {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
