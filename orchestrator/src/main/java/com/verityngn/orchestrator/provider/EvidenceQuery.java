package com.verityngn.orchestrator.provider;

/**
 * @param claimText the claim to find evidence for
 * @param context   extra search context, e.g. the video reference
 */
public record EvidenceQuery(String claimText, String context) {}
