package com.verityngn.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a mutation would break the job state machine or the
 * write-once rule for stage results. Always a programming error.
 */
public class IllegalJobTransitionException extends RuntimeException {

    public IllegalJobTransitionException(UUID jobId, String message) {
        super("Job " + jobId + ": " + message);
    }
}
