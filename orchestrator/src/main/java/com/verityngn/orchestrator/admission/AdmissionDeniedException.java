package com.verityngn.orchestrator.admission;

/**
 * Submission rejected because the tenant is at its concurrency cap and its
 * queue is full. Nothing is persisted for a rejected submission.
 */
public class AdmissionDeniedException extends RuntimeException {

    private final String tenantId;

    public AdmissionDeniedException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public String getTenantId() { return tenantId; }
}
