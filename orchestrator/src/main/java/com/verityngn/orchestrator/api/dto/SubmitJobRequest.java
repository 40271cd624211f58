package com.verityngn.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.verityngn.orchestrator.model.SubmissionOptions;

/**
 * Request body for POST /jobs.
 *
 * Required: tenantId, videoReference (absolute http(s) URL)
 * Optional: options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitJobRequest(String tenantId, String videoReference, OptionsRequest options) {

    public SubmissionOptions submissionOptions() {
        return options == null ? SubmissionOptions.defaults() : options.toOptions();
    }
}
