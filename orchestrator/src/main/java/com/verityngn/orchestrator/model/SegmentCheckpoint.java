package com.verityngn.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Result of one analysed video segment, flushed as soon as the segment
 * finishes so a retried or resumed attempt skips it. Uniquely keyed by
 * (stageName, segmentIndex). Dropped once the stage result is recorded.
 */
@Embeddable
public class SegmentCheckpoint {

    @Column(name = "stage_name", nullable = false)
    private String stageName;

    @Column(name = "segment_index", nullable = false)
    private int segmentIndex;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    protected SegmentCheckpoint() {}   // required by JPA

    public SegmentCheckpoint(String stageName, int segmentIndex, String payload) {
        this.stageName    = stageName;
        this.segmentIndex = segmentIndex;
        this.payload      = payload;
    }

    public String getStageName()    { return stageName; }
    public int    getSegmentIndex() { return segmentIndex; }
    public String getPayload()      { return payload; }
}
