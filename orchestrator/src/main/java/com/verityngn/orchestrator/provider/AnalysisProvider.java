package com.verityngn.orchestrator.provider;

/**
 * Provider for SEGMENTED_ANALYSIS stages. Called concurrently for different
 * segments of the same video, so implementations must be thread-safe.
 */
public interface AnalysisProvider extends Provider {

    @Override
    default Capability capability() { return Capability.ANALYSIS; }

    AnalysisResult analyze(VideoSegment segment) throws ProviderException;
}
