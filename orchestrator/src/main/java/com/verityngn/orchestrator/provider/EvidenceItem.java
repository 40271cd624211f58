package com.verityngn.orchestrator.provider;

/**
 * One piece of retrieved evidence.
 *
 * @param sourceReference URL or identifier of the source
 * @param content         extracted text
 * @param relevance       provider-assigned relevance score, higher is better
 */
public record EvidenceItem(String sourceReference, String content, double relevance) {}
