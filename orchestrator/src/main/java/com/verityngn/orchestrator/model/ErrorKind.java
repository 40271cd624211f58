package com.verityngn.orchestrator.model;

/**
 * Error categories recorded on a FAILED job and returned to pollers.
 */
public enum ErrorKind {
    STAGE_FAILED,       // a required stage exhausted its fallback chain
    INCOMPLETE_INPUT,   // report assembly found a required stage result missing
    INTERNAL            // unexpected executor error
}
