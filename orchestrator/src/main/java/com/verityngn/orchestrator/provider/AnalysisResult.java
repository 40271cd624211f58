package com.verityngn.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Multimodal analysis of one segment.
 *
 * @param claims  claim statements found in the segment
 * @param details provider-specific extra output, may be null
 */
public record AnalysisResult(List<String> claims, JsonNode details) {

    public AnalysisResult {
        claims = claims == null ? List.of() : List.copyOf(claims);
    }
}
