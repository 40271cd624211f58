package com.verityngn.orchestrator.api;

import com.verityngn.orchestrator.api.dto.JobListResponse;
import com.verityngn.orchestrator.api.dto.JobStatusResponse;
import com.verityngn.orchestrator.api.dto.StageResultResponse;
import com.verityngn.orchestrator.api.dto.SubmitJobRequest;
import com.verityngn.orchestrator.api.dto.SubmitJobResponse;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for job lifecycle.
 *
 * POST /jobs               — submit a video for verification
 * GET  /jobs?tenantId=&status= — list a tenant's jobs, optionally by status
 * GET  /jobs/{id}          — poll status and progress
 * GET  /jobs/{id}/stages   — recorded stage results
 * GET  /jobs/{id}/report   — final (or partial) report, 202 until there is one
 * POST /jobs/{id}/cancel   — request cancellation
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Submit a video.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"tenantId":"acme","videoReference":"https://www.youtube.com/watch?v=abc123"}'
     */
    @PostMapping
    public ResponseEntity<SubmitJobResponse> submit(@RequestBody SubmitJobRequest req) {
        Job job = jobService.submit(req.tenantId(), req.videoReference(), req.submissionOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmitJobResponse.from(job));
    }

    /**
     * List a tenant's jobs, oldest first.
     *
     * Example:
     *   curl 'http://localhost:8080/jobs?tenantId=acme&status=QUEUED,RUNNING'
     */
    @GetMapping
    public JobListResponse list(@RequestParam(required = false) String tenantId,
                                @RequestParam(required = false) Set<JobStatus> status) {
        return JobListResponse.of(jobService.list(tenantId, status).stream()
                .map(job -> JobStatusResponse.from(job, jobService.currentStage(job)))
                .toList());
    }

    @GetMapping("/{id}")
    public JobStatusResponse getJob(@PathVariable UUID id) {
        Job job = jobService.get(id);
        return JobStatusResponse.from(job, jobService.currentStage(job));
    }

    @GetMapping("/{id}/stages")
    public List<StageResultResponse> getStages(@PathVariable UUID id) {
        return jobService.stages(id).stream()
                .map(StageResultResponse::from)
                .toList();
    }

    /**
     * HTTP 200 — report JSON (complete, or partial for a FAILED job when enabled)
     * HTTP 202 — no report yet; body is the poll view
     * HTTP 404 — job ID not found
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<Object> getReport(@PathVariable UUID id) {
        return jobService.report(id)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    Job job = jobService.get(id);
                    return ResponseEntity.accepted().body(JobStatusResponse.from(job, jobService.currentStage(job)));
                });
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobStatusResponse> cancel(@PathVariable UUID id) {
        Job job = jobService.cancel(id);
        return ResponseEntity.accepted().body(JobStatusResponse.from(job, jobService.currentStage(job)));
    }
}
