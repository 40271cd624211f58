package com.verityngn.orchestrator.provider;

/**
 * Provider for EVIDENCE_SEARCH stages (web search, video search, fact-check databases).
 */
public interface EvidenceProvider extends Provider {

    @Override
    default Capability capability() { return Capability.EVIDENCE; }

    EvidenceResult query(EvidenceQuery query) throws ProviderException;
}
