package com.verityngn.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a verification Job.
 *
 * Transitions:
 *   QUEUED  → RUNNING   (promoted by the dispatcher when a slot is free)
 *   QUEUED  → CANCELLED (cancelled before it ever ran)
 *   RUNNING → COMPLETED | FAILED | CANCELLED
 *
 * Advancing from one stage to the next keeps the job RUNNING.
 * Terminal states never transition again.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** Statuses that hold a concurrency slot. */
    public static final Set<JobStatus> ACTIVE = EnumSet.of(RUNNING);

    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED    -> next == RUNNING || next == CANCELLED;
            case RUNNING   -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
