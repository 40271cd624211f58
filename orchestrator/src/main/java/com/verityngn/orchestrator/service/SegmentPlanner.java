package com.verityngn.orchestrator.service;

import com.verityngn.orchestrator.provider.VideoSegment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a video into contiguous analysis windows.
 *
 * The analysed span is min(duration, maxDuration); it is cut into
 * ceil(span / segmentDuration) windows, the last one possibly shorter.
 */
public class SegmentPlanner {

    private final Duration segmentDuration;

    public SegmentPlanner(Duration segmentDuration) {
        if (segmentDuration == null || segmentDuration.getSeconds() < 1) {
            throw new IllegalArgumentException("segment-duration must be at least one second");
        }
        this.segmentDuration = segmentDuration;
    }

    public List<VideoSegment> plan(String videoReference, long durationSeconds, long maxDurationSeconds) {
        long span = Math.min(Math.max(0, durationSeconds), maxDurationSeconds);
        long step = segmentDuration.getSeconds();
        List<VideoSegment> segments = new ArrayList<>();
        int index = 0;
        for (long start = 0; start < span; start += step) {
            segments.add(new VideoSegment(videoReference, index++, start, Math.min(start + step, span)));
        }
        return segments;
    }

    public Duration segmentDuration() {
        return segmentDuration;
    }
}
