package com.verityngn.orchestrator.provider;

/**
 * One contiguous time window of a video, [startSeconds, endSeconds).
 */
public record VideoSegment(String videoReference, int index, long startSeconds, long endSeconds) {

    public long durationSeconds() {
        return endSeconds - startSeconds;
    }
}
