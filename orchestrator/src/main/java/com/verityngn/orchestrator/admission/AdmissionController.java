package com.verityngn.orchestrator.admission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.model.IllegalJobTransitionException;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.SubmissionOptions;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns submissions into QUEUED jobs and promotes them to RUNNING as
 * capacity frees up.
 *
 * A job holds a slot exactly while it is RUNNING, so slot accounting is
 * derived from the store rather than kept in memory: the terminal transition
 * releases the slot on every path, including worker crashes. Promotion uses
 * compare-and-update, so two dispatchers racing on the same job admit it once.
 *
 * Queues are FIFO per tenant (oldest created_at first); a tenant at its cap
 * never blocks other tenants.
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final JobStore           store;
    private final PipelineDefinition pipeline;
    private final AdmissionPolicy    policy;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;

    public AdmissionController(JobStore store, PipelineDefinition pipeline, AdmissionPolicy policy,
                               ObjectMapper objectMapper, Clock clock) {
        this.store        = store;
        this.pipeline     = pipeline;
        this.policy       = policy;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate and persist a new job as QUEUED. The dispatcher promotes it.
     *
     * @throws ValidationException      malformed tenant, video reference or overrides
     * @throws AdmissionDeniedException tenant at cap with a full bounded queue
     */
    public synchronized UUID submit(String tenantId, String videoReference, SubmissionOptions options) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        validateVideoReference(videoReference);
        SubmissionOptions opts = options == null ? SubmissionOptions.defaults() : options;
        try {
            pipeline.withOverrides(opts.stageOverrides());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid stage override: " + e.getMessage(), e);
        }

        if (policy.queueBounded()) {
            int running = store.listByTenantAndStatus(tenantId, Set.of(JobStatus.RUNNING)).size();
            if (running >= policy.capFor(tenantId)) {
                int queued = store.listByTenantAndStatus(tenantId, Set.of(JobStatus.QUEUED)).size();
                if (queued >= policy.maxQueuedPerTenant()) {
                    log.warn("Admission denied for tenant '{}': {} running (cap {}), {} queued (max {})",
                            tenantId, running, policy.capFor(tenantId), queued, policy.maxQueuedPerTenant());
                    throw new AdmissionDeniedException(tenantId,
                            "Tenant '" + tenantId + "' is at its concurrency cap and its queue is full");
                }
            }
        }

        Job job = new Job(tenantId, videoReference, writeOptions(opts), pipeline.size(), clock.instant());
        UUID id = store.create(job);
        log.info("Job {} admitted for tenant '{}' (QUEUED)", id, tenantId);
        return id;
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Promote every QUEUED job that fits under the tenant and global caps,
     * oldest first.
     *
     * @return ids of the jobs this call moved to RUNNING
     */
    public synchronized List<UUID> promoteEligible(String workerId) {
        List<Job> running = store.listByStatus(Set.of(JobStatus.RUNNING));
        int globalRunning = running.size();
        if (globalRunning >= policy.globalCap()) {
            return List.of();
        }
        Map<String, Integer> perTenant = new HashMap<>();
        running.forEach(j -> perTenant.merge(j.getTenantId(), 1, Integer::sum));

        List<UUID> promoted = new ArrayList<>();
        for (Job candidate : store.listByStatus(Set.of(JobStatus.QUEUED))) {
            if (globalRunning >= policy.globalCap()) {
                break;
            }
            String tenant = candidate.getTenantId();
            if (perTenant.getOrDefault(tenant, 0) >= policy.capFor(tenant)) {
                continue;
            }
            try {
                store.compareAndUpdate(candidate.getId(), candidate.getVersion(),
                        j -> j.promote(workerId, clock.instant()));
            } catch (VersionConflictException | IllegalJobTransitionException e) {
                // Cancelled or promoted elsewhere since the scan; the next tick re-reads.
                log.debug("Skipping job {} during promotion: {}", candidate.getId(), e.getMessage());
                continue;
            }
            globalRunning++;
            perTenant.merge(tenant, 1, Integer::sum);
            promoted.add(candidate.getId());
            log.info("Job {} promoted QUEUED → RUNNING (tenant '{}', worker '{}')",
                    candidate.getId(), tenant, workerId);
        }
        return promoted;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void validateVideoReference(String videoReference) {
        if (videoReference == null || videoReference.isBlank()) {
            throw new ValidationException("videoReference is required");
        }
        try {
            URI uri = new URI(videoReference.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ValidationException("videoReference must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("videoReference is not a valid URL: " + e.getMessage(), e);
        }
    }

    private String writeOptions(SubmissionOptions options) {
        try {
            return objectMapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise submission options", e);
        }
    }
}
