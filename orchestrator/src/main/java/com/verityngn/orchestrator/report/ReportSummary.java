package com.verityngn.orchestrator.report;

import java.util.List;
import java.util.Map;

/**
 * @param verdictCounts claims per verdict, every verdict present
 * @param keyIssue      one-sentence explanation of the assessment
 * @param mainConcerns  explanations of up to three false claims
 */
public record ReportSummary(
        AssessmentLevel      assessment,
        int                  claimCount,
        Map<Verdict, Integer> verdictCounts,
        String               keyIssue,
        List<String>         mainConcerns) {}
