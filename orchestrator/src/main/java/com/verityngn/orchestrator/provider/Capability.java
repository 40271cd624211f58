package com.verityngn.orchestrator.provider;

/**
 * What kind of call a provider answers; decides which stage kinds may use it.
 */
public enum Capability {
    STAGE,      // StageProvider: whole-stage call with prior results
    ANALYSIS,   // AnalysisProvider: one video segment at a time
    EVIDENCE    // EvidenceProvider: one claim query at a time
}
