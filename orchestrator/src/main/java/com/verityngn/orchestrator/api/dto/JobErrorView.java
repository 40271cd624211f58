package com.verityngn.orchestrator.api.dto;

import com.verityngn.orchestrator.model.ErrorKind;

/** Error block of a FAILED job's poll response. */
public record JobErrorView(ErrorKind kind, String stage, String message) {}
