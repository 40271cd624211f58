package com.verityngn.orchestrator.service;

/**
 * The worker thread was interrupted, typically because the process is shutting
 * down. The job stays RUNNING and is picked up by stall recovery or
 * resume-on-startup.
 */
public class WorkerInterruptedException extends RuntimeException {

    public WorkerInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
