package com.verityngn.orchestrator.report;

/** Pointer to a source that supports or refutes a claim. */
public record EvidenceReference(String source, double relevance) {}
